package com.daniel.podcast.podcasthub.sync;

import com.daniel.podcast.podcasthub.store.StoredPodcast;

// alreadySubscribed: the canonical feed URL was known, so nothing was created or synced.
public record SubscriptionResult(StoredPodcast podcast, boolean alreadySubscribed) {
}
