package com.daniel.podcast.podcasthub.model;

import java.util.List;

/*
 * Resolver output for one share link.
 * episodeCount mirrors the size of the batch seen in the triggering fetch (0 for stub resolvers),
 * and episodes carries that batch when the resolver already had to download it.
 */
public record PodcastInfo(
        PlatformTag platform,
        String title,
        String description,
        String imageUrl,
        String feedUrl,
        String sourceUrl,
        String author,
        String category,
        int episodeCount,
        List<EpisodeEntry> episodes
) {

    public PodcastInfo {
        title = nullToEmpty(title);
        description = nullToEmpty(description);
        imageUrl = nullToEmpty(imageUrl);
        feedUrl = nullToEmpty(feedUrl);
        sourceUrl = nullToEmpty(sourceUrl);
        author = nullToEmpty(author);
        category = nullToEmpty(category);
        episodeCount = Math.max(episodeCount, 0);
        episodes = episodes == null ? List.of() : List.copyOf(episodes);
    }

    public boolean hasEpisodes() {
        return !episodes.isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
