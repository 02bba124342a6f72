package com.daniel.podcast.podcasthub.store;

import java.time.Instant;

import com.daniel.podcast.podcasthub.model.PlatformTag;

// Persisted podcast row. episodeCount is the size of the last fetched batch, not a row count.
public record StoredPodcast(
        long id,
        PlatformTag platform,
        String title,
        String description,
        String imageUrl,
        String feedUrl,
        String sourceUrl,
        String author,
        String category,
        int episodeCount,
        Instant createdAt,
        Instant updatedAt
) {

    public StoredPodcast withEpisodeCount(int count, Instant now) {
        return new StoredPodcast(id, platform, title, description, imageUrl, feedUrl, sourceUrl,
                author, category, count, createdAt, now);
    }
}
