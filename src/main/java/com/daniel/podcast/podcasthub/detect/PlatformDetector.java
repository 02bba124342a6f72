package com.daniel.podcast.podcasthub.detect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.daniel.podcast.podcasthub.config.PodcastHubProperties;
import com.daniel.podcast.podcasthub.model.PlatformTag;

@Component
// Pure URL classifier; no network access, never throws.
public class PlatformDetector {

    /*
     * Ordered table, first match wins.
     * Feed mirrors come before the Xiaoyuzhou page domains because feed hosts such as
     * feed.xyzfm.space contain a page domain as a substring.
     */
    private static final List<String> FEED_MIRROR_DOMAINS = List.of(
            "feed.xyzfm.space", "feeds.danlirencomedy.com", "feed.xiaoyuzhoufm.com");
    private static final List<String> XIAOYUZHOU_DOMAINS = List.of(
            "xiaoyuzhoufm.com", "www.xiaoyuzhoufm.com", "xyzfm.space");
    private static final List<String> NETEASE_DOMAINS = List.of("music.163.com");
    private static final List<String> APPLE_DOMAINS = List.of("podcasts.apple.com");
    private static final List<String> SPOTIFY_DOMAINS = List.of("open.spotify.com");

    private final Map<PlatformTag, List<String>> domainTable;

    public PlatformDetector(PodcastHubProperties properties) {
        List<String> feedDomains = new ArrayList<>(FEED_MIRROR_DOMAINS);
        feedDomains.addAll(properties.normalizedExtraFeedHosts());

        Map<PlatformTag, List<String>> table = new LinkedHashMap<>();
        table.put(PlatformTag.RSS, List.copyOf(feedDomains));
        table.put(PlatformTag.XIAOYUZHOU, XIAOYUZHOU_DOMAINS);
        table.put(PlatformTag.NETEASE, NETEASE_DOMAINS);
        table.put(PlatformTag.APPLE, APPLE_DOMAINS);
        table.put(PlatformTag.SPOTIFY, SPOTIFY_DOMAINS);
        this.domainTable = table;
    }

    public PlatformTag detect(String url) {
        if (url == null || url.isBlank()) {
            return PlatformTag.UNKNOWN;
        }
        for (Map.Entry<PlatformTag, List<String>> row : domainTable.entrySet()) {
            for (String domain : row.getValue()) {
                if (url.contains(domain)) {
                    return row.getKey();
                }
            }
        }
        return PlatformTag.UNKNOWN;
    }
}
