package com.daniel.podcast.podcasthub.model;

/*
 * One episode as seen in a single fetch (feed item or page entry).
 * audioUrl is the dedup key inside a podcast; rawPubDate stays unparsed until sync.
 */
public record EpisodeEntry(
        String title,
        String description,
        String audioUrl,
        int durationSeconds,
        String rawPubDate
) {

    public EpisodeEntry {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        audioUrl = audioUrl == null ? "" : audioUrl;
        durationSeconds = Math.max(durationSeconds, 0);
    }

    // Page fallback only knows title + audio URL.
    public static EpisodeEntry titleAndAudio(String title, String audioUrl) {
        return new EpisodeEntry(title, "", audioUrl, 0, null);
    }
}
