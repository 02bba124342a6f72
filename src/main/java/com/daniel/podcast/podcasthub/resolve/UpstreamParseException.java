package com.daniel.podcast.podcasthub.resolve;

// Upstream body could not be parsed. Caught inside the engine to trigger fallbacks.
public class UpstreamParseException extends PodcastResolutionException {

    public UpstreamParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
