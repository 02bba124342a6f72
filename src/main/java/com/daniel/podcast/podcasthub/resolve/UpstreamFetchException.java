package com.daniel.podcast.podcasthub.resolve;

/*
 * Upstream returned nothing usable (transport error, non-2xx, or an empty lookup result).
 * Only thrown when the resolver has no metadata at all to fall back to.
 */
public class UpstreamFetchException extends PodcastResolutionException {

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
