package com.daniel.podcast.podcasthub.resolve;

// The detector could not match the link to any known platform.
public class UnsupportedPlatformException extends PodcastResolutionException {

    private final String url;

    public UnsupportedPlatformException(String url) {
        super("Unsupported platform: " + url);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
