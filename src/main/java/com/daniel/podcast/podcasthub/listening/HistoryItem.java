package com.daniel.podcast.podcasthub.listening;

import java.time.Instant;

public record HistoryItem(
        long id,
        long episodeId,
        long podcastId,
        String title,
        String podcastTitle,
        Instant playedAt
) {
}
