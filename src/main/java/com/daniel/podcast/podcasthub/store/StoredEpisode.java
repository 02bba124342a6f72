package com.daniel.podcast.podcasthub.store;

import java.time.Instant;

// played/progressSeconds/playedAt are listening state; sync never touches them.
public record StoredEpisode(
        long id,
        long podcastId,
        String title,
        String description,
        String audioUrl,
        int durationSeconds,
        Instant pubDate,
        int episodeNum,
        Instant createdAt,
        boolean played,
        int progressSeconds,
        Instant playedAt
) {

    public StoredEpisode markPlayed() {
        return new StoredEpisode(id, podcastId, title, description, audioUrl, durationSeconds, pubDate,
                episodeNum, createdAt, true, progressSeconds, playedAt);
    }

    public StoredEpisode withProgress(int seconds, Instant now) {
        return new StoredEpisode(id, podcastId, title, description, audioUrl, durationSeconds, pubDate,
                episodeNum, createdAt, played, seconds, now);
    }
}
