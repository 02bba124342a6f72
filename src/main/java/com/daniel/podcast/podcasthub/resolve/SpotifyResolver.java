package com.daniel.podcast.podcasthub.resolve;

import java.util.List;

import org.springframework.stereotype.Component;

import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;

@Component
public class SpotifyResolver implements PodcastResolver {

    static final String UNSUPPORTED_DESCRIPTION =
            "Spotify episode extraction is not supported; only the share link was recorded.";

    @Override
    public PlatformTag platform() {
        return PlatformTag.SPOTIFY;
    }

    // Spotify show data needs an authenticated Web API client, so the link is kept as-is.
    @Override
    public PodcastInfo resolve(String url) {
        return new PodcastInfo(
                PlatformTag.SPOTIFY,
                "Spotify podcast",
                UNSUPPORTED_DESCRIPTION,
                "",
                url,
                url,
                "",
                PlatformTag.SPOTIFY.displayName(),
                0,
                List.of());
    }
}
