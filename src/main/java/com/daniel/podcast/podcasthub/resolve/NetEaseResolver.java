package com.daniel.podcast.podcasthub.resolve;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.daniel.podcast.podcasthub.config.PodcastHubProperties;
import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;

@Component
// Purely syntactic: NetEase pages are not scraped; episodes come later from a third-party feed mirror.
public class NetEaseResolver implements PodcastResolver {

    private static final String DEFAULT_TITLE = "NetEase Cloud Music podcast";

    // music.163.com/#/djradio?id=123 and music.163.com/djradio/123
    private static final List<Pattern> ID_PATTERNS = List.of(
            Pattern.compile("[?&]id=(\\d+)"),
            Pattern.compile("/djradio/(\\d+)"));

    private final PodcastHubProperties properties;

    public NetEaseResolver(PodcastHubProperties properties) {
        this.properties = properties;
    }

    @Override
    public PlatformTag platform() {
        return PlatformTag.NETEASE;
    }

    @Override
    public PodcastInfo resolve(String url) {
        String podcastId = extractId(url)
                .orElseThrow(() -> new MalformedPlatformIdException(PlatformTag.NETEASE, url));

        return new PodcastInfo(
                PlatformTag.NETEASE,
                DEFAULT_TITLE,
                "",
                "",
                properties.normalizedNeteaseFeedPrefix() + podcastId,
                url,
                "",
                PlatformTag.NETEASE.displayName(),
                0,
                List.of());
    }

    Optional<String> extractId(String url) {
        for (Pattern pattern : ID_PATTERNS) {
            Matcher matcher = pattern.matcher(url);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
