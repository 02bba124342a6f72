package com.daniel.podcast.podcasthub.listening;

// What a player needs to start an episode.
public record PlaybackTicket(
        String audioUrl,
        String title,
        String podcastTitle,
        String imageUrl
) {
}
