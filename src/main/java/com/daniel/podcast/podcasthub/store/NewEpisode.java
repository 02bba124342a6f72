package com.daniel.podcast.podcasthub.store;

import java.time.Instant;

// Insert payload built by the synchronizer; the store assigns id and createdAt.
public record NewEpisode(
        String title,
        String description,
        String audioUrl,
        int durationSeconds,
        Instant pubDate,
        int episodeNum
) {
}
