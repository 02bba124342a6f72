package com.daniel.podcast.podcasthub.store;

// Result of get-or-create: created is false when a podcast with the same feed URL already existed.
public record PodcastLookup(StoredPodcast podcast, boolean created) {
}
