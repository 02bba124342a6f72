package com.daniel.podcast.podcasthub.model;

// Closed set of link sources; UNKNOWN is a valid detector result, not an error.
public enum PlatformTag {
    XIAOYUZHOU("Xiaoyuzhou"),
    NETEASE("NetEase"),
    APPLE("Apple"),
    SPOTIFY("Spotify"),
    RSS("RSS"),
    UNKNOWN("Unknown");

    private final String displayName;

    PlatformTag(String displayName) {
        this.displayName = displayName;
    }

    // Used as the default category for podcasts that carry no genre of their own.
    public String displayName() {
        return displayName;
    }
}
