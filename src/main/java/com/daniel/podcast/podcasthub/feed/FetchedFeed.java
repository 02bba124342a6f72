package com.daniel.podcast.podcasthub.feed;

import java.util.List;

import com.daniel.podcast.podcasthub.model.EpisodeEntry;
import com.rometools.rome.feed.synd.SyndFeed;

// One successful feed download: raw markup (for tag scans Rome does not expose), parsed feed, mapped entries.
public record FetchedFeed(
        String rawXml,
        SyndFeed feed,
        List<EpisodeEntry> entries
) {

    public FetchedFeed {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
