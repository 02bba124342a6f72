package com.daniel.podcast.podcasthub.fetch;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Blocking HTTP GET used by every resolver and extraction engine.
 * Implementations report non-success statuses and transport errors as {@link Optional#empty()}
 * and never let a transport exception escape.
 */
@FunctionalInterface
public interface HttpFetcher {

    Optional<String> get(String url, Map<String, String> headers, Duration timeout);
}
