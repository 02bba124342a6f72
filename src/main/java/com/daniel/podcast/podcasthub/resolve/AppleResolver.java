package com.daniel.podcast.podcasthub.resolve;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.daniel.podcast.podcasthub.config.PodcastHubProperties;
import com.daniel.podcast.podcasthub.fetch.HttpFetcher;
import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@Component
public class AppleResolver implements PodcastResolver {

    /*
     * Apple share links carry the collection id in the path (/id1234567890).
     * Metadata comes from the public iTunes lookup endpoint; unlike the other resolvers there is
     * no stub to fall back to, so a failed or empty lookup is surfaced as UpstreamFetchException.
     */
    private static final Logger log = LoggerFactory.getLogger(AppleResolver.class);
    private static final Pattern COLLECTION_ID = Pattern.compile("/id(\\d+)");
    private static final String DEFAULT_TITLE = "Apple podcast";

    private final HttpFetcher httpFetcher;
    private final PodcastHubProperties properties;
    private final ObjectMapper objectMapper;

    public AppleResolver(HttpFetcher httpFetcher, PodcastHubProperties properties, ObjectMapper objectMapper) {
        this.httpFetcher = httpFetcher;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public PlatformTag platform() {
        return PlatformTag.APPLE;
    }

    @Override
    public PodcastInfo resolve(String url) {
        Matcher matcher = COLLECTION_ID.matcher(url);
        if (!matcher.find()) {
            throw new MalformedPlatformIdException(PlatformTag.APPLE, url);
        }
        String collectionId = matcher.group(1);
        String lookupUrl = properties.normalizedAppleLookupUrl() + "?id=" + collectionId + "&entity=podcast";

        String body = httpFetcher.get(lookupUrl, Map.of("Accept", "application/json"), properties.effectiveLookupTimeout())
                .orElseThrow(() -> new UpstreamFetchException("Apple lookup failed for id " + collectionId));

        JsonNode results = readResults(body, collectionId);
        if (!results.isArray() || results.isEmpty()) {
            throw new UpstreamFetchException("Apple lookup returned no podcast for id " + collectionId);
        }
        return toPodcastInfo(results.get(0), url);
    }

    private JsonNode readResults(String body, String collectionId) {
        try {
            return objectMapper.readTree(body).path("results");
        } catch (JsonProcessingException ex) {
            log.warn("Apple lookup body for id {} is not JSON: {}", collectionId, ex.getOriginalMessage());
            throw new UpstreamFetchException("Apple lookup returned an unreadable body for id " + collectionId, ex);
        }
    }

    // Lookup results carry no show description; the artist page link is the closest stand-in.
    private PodcastInfo toPodcastInfo(JsonNode result, String url) {
        String description = text(result, "description", text(result, "artistViewUrl", ""));
        return new PodcastInfo(
                PlatformTag.APPLE,
                text(result, "collectionName", DEFAULT_TITLE),
                description,
                text(result, "artworkUrl600", ""),
                text(result, "feedUrl", ""),
                url,
                text(result, "artistName", ""),
                text(result, "primaryGenreName", PlatformTag.APPLE.displayName()),
                0,
                List.of());
    }

    private String text(JsonNode node, String field, String fallback) {
        String value = node.path(field).asText("");
        return value.isBlank() ? fallback : value.trim();
    }
}
