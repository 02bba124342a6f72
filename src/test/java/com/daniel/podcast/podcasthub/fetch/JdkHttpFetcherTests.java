package com.daniel.podcast.podcasthub.fetch;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

// Transport problems come back as Optional.empty(), never as exceptions.
class JdkHttpFetcherTests {

    private final JdkHttpFetcher fetcher = new JdkHttpFetcher();

    @Test
    void malformedUrlIsEmpty() {
        assertTrue(fetcher.get("not a url", Map.of(), Duration.ofSeconds(1)).isEmpty());
    }

    @Test
    void refusedConnectionIsEmpty() {
        assertTrue(fetcher.get("http://127.0.0.1:1/feed.xml", Map.of("User-Agent", "Mozilla/5.0"), Duration.ofSeconds(2)).isEmpty());
    }
}
