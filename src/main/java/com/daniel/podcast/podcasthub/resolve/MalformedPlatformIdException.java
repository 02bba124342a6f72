package com.daniel.podcast.podcasthub.resolve;

import com.daniel.podcast.podcasthub.model.PlatformTag;

// The link belongs to a known platform but carries no usable podcast id.
public class MalformedPlatformIdException extends PodcastResolutionException {

    private final PlatformTag platform;

    public MalformedPlatformIdException(PlatformTag platform, String url) {
        super("Cannot read a " + platform.displayName() + " podcast id from: " + url);
        this.platform = platform;
    }

    public PlatformTag platform() {
        return platform;
    }
}
