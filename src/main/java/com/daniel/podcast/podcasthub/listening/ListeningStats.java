package com.daniel.podcast.podcasthub.listening;

import java.util.List;

// Totals over the whole play history; topPodcasts is ordered by play count.
public record ListeningStats(
        long totalPlays,
        long totalDuration,
        String totalDurationText,
        List<PodcastPlays> topPodcasts
) {

    public record PodcastPlays(long id, String title, long count) {
    }
}
