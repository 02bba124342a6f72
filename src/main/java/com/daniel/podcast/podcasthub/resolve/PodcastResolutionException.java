package com.daniel.podcast.podcasthub.resolve;

// Root of every failure the resolution engine can surface to a caller.
public abstract class PodcastResolutionException extends RuntimeException {

    protected PodcastResolutionException(String message) {
        super(message);
    }

    protected PodcastResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
