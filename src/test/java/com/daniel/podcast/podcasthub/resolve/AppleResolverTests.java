package com.daniel.podcast.podcasthub.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.daniel.podcast.podcasthub.config.PodcastHubProperties;
import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;
import com.daniel.podcast.podcasthub.support.Fixtures;
import com.daniel.podcast.podcasthub.support.StubHttpFetcher;
import com.fasterxml.jackson.databind.ObjectMapper;

class AppleResolverTests {

    private static final String SHARE_URL = "https://podcasts.apple.com/us/podcast/morning-briefing/id1234567890";
    private static final String LOOKUP_URL = "https://itunes.apple.com/lookup?id=1234567890&entity=podcast";

    private final StubHttpFetcher fetcher = new StubHttpFetcher();
    private final PodcastHubProperties properties = new PodcastHubProperties();
    private final AppleResolver resolver = new AppleResolver(fetcher, properties, new ObjectMapper());

    @Test
    void mapsFirstLookupResult() {
        fetcher.respond(LOOKUP_URL, Fixtures.read("apple-lookup.json"));

        PodcastInfo info = resolver.resolve(SHARE_URL);

        assertEquals(PlatformTag.APPLE, info.platform());
        assertEquals("Morning Briefing", info.title());
        assertEquals("https://podcasts.apple.com/us/artist/morning-desk/99", info.description());
        assertEquals("https://is1-ssl.mzstatic.com/image/thumb/600x600bb.jpg", info.imageUrl());
        assertEquals("https://feeds.example.com/morning.xml", info.feedUrl());
        assertEquals(SHARE_URL, info.sourceUrl());
        assertEquals("Morning Desk", info.author());
        assertEquals("News", info.category());
        assertEquals(0, info.episodeCount());
    }

    @Test
    void lookupUsesShorterTimeout() {
        fetcher.respond(LOOKUP_URL, Fixtures.read("apple-lookup.json"));

        resolver.resolve(SHARE_URL);

        assertEquals(properties.effectiveLookupTimeout(), fetcher.lastRequest().timeout());
        assertEquals(LOOKUP_URL, fetcher.lastRequest().url());
    }

    // Missing optional fields fall back to platform defaults.
    @Test
    void sparseResultUsesDefaults() {
        fetcher.respond(LOOKUP_URL, "{\"resultCount\":1,\"results\":[{\"feedUrl\":\"https://feeds.example.com/x.xml\"}]}");

        PodcastInfo info = resolver.resolve(SHARE_URL);

        assertEquals("Apple podcast", info.title());
        assertEquals("Apple", info.category());
        assertEquals("", info.description());
    }

    @Test
    void linkWithoutIdIsRejected() {
        assertThrows(MalformedPlatformIdException.class,
                () -> resolver.resolve("https://podcasts.apple.com/us/podcast/morning-briefing"));
    }

    @Test
    void emptyResultsAreAnUpstreamFailure() {
        fetcher.respond(LOOKUP_URL, "{\"resultCount\":0,\"results\":[]}");

        assertThrows(UpstreamFetchException.class, () -> resolver.resolve(SHARE_URL));
    }

    @Test
    void failedLookupIsAnUpstreamFailure() {
        assertThrows(UpstreamFetchException.class, () -> resolver.resolve(SHARE_URL));
    }

    @Test
    void nonJsonBodyIsAnUpstreamFailure() {
        fetcher.respond(LOOKUP_URL, "<html>maintenance</html>");

        assertThrows(UpstreamFetchException.class, () -> resolver.resolve(SHARE_URL));
    }
}
