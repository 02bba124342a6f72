package com.daniel.podcast.podcasthub.page;

import java.util.List;

import com.daniel.podcast.podcasthub.model.EpisodeEntry;

// What one extraction strategy read from a show page.
public record PageExtraction(
        String title,
        String author,
        String description,
        List<EpisodeEntry> episodes
) {

    public PageExtraction {
        title = title == null ? "" : title;
        author = author == null ? "" : author;
        description = description == null ? "" : description;
        episodes = episodes == null ? List.of() : List.copyOf(episodes);
    }

    public static PageExtraction empty() {
        return new PageExtraction("", "", "", List.of());
    }
}
