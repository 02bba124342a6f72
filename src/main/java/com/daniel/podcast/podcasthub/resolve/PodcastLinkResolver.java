package com.daniel.podcast.podcasthub.resolve;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.daniel.podcast.podcasthub.detect.PlatformDetector;
import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;

@Service
// Entry point for share links: detect the platform once, then hand off to that platform's resolver.
public class PodcastLinkResolver {

    private static final Logger log = LoggerFactory.getLogger(PodcastLinkResolver.class);

    private final PlatformDetector platformDetector;
    private final Map<PlatformTag, PodcastResolver> resolvers;

    public PodcastLinkResolver(PlatformDetector platformDetector, List<PodcastResolver> resolvers) {
        this.platformDetector = platformDetector;
        Map<PlatformTag, PodcastResolver> byPlatform = new EnumMap<>(PlatformTag.class);
        for (PodcastResolver resolver : resolvers) {
            PodcastResolver previous = byPlatform.put(resolver.platform(), resolver);
            if (previous != null) {
                throw new IllegalStateException("Two resolvers registered for " + resolver.platform());
            }
        }
        this.resolvers = byPlatform;
    }

    public PodcastInfo resolve(String url) {
        PlatformTag platform = platformDetector.detect(url);
        PodcastResolver resolver = resolvers.get(platform);
        if (platform == PlatformTag.UNKNOWN || resolver == null) {
            throw new UnsupportedPlatformException(url);
        }
        PodcastInfo info = resolver.resolve(url);
        log.info("Resolved {} link '{}' to '{}' ({} episodes)", platform, url, info.title(), info.episodeCount());
        return info;
    }
}
