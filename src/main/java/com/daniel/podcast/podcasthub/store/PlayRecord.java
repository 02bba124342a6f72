package com.daniel.podcast.podcasthub.store;

import java.time.Instant;

// One play-history row. durationSeconds is copied from the episode when the play is recorded.
public record PlayRecord(
        long id,
        long episodeId,
        long podcastId,
        Instant playedAt,
        int progressSeconds,
        int durationSeconds
) {
}
