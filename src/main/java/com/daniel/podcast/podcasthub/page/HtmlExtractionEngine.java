package com.daniel.podcast.podcasthub.page;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.daniel.podcast.podcasthub.config.PodcastHubProperties;
import com.daniel.podcast.podcasthub.fetch.HttpFetcher;
import com.daniel.podcast.podcasthub.model.EpisodeEntry;
import com.fasterxml.jackson.databind.ObjectMapper;

@Service
public class HtmlExtractionEngine {

    /*
     * Reads Xiaoyuzhou show pages.
     * Used twice:
     * - by the Xiaoyuzhou resolver, which also wants cover image and show id
     * - by refresh/sync flows that only need the episode list of a known page URL
     * Both go through the same strategy pipeline: structured data first, quoted-field scan second.
     */
    private static final Pattern SHOW_ID = Pattern.compile("\"podcast\":\\{[^}]*\"pid\":\"([a-zA-Z0-9]+)\"");

    private final HttpFetcher httpFetcher;
    private final PodcastHubProperties properties;
    private final PageExtractionPipeline pipeline;
    private final Logger log;

    @Autowired
    public HtmlExtractionEngine(HttpFetcher httpFetcher, PodcastHubProperties properties, ObjectMapper objectMapper) {
        this(httpFetcher, properties, objectMapper, LoggerFactory.getLogger(HtmlExtractionEngine.class));
    }

    public HtmlExtractionEngine(HttpFetcher httpFetcher, PodcastHubProperties properties, ObjectMapper objectMapper, Logger log) {
        this.httpFetcher = httpFetcher;
        this.properties = properties;
        this.log = log;

        AudioUrlScanner audioUrlScanner = new AudioUrlScanner(properties.effectiveAudioCdnHost());
        this.pipeline = new PageExtractionPipeline(List.of(
                new StructuredDataStrategy(objectMapper, audioUrlScanner, log),
                new QuotedFieldFallbackStrategy(audioUrlScanner)));
    }

    public List<EpisodeEntry> listEpisodesFromPage(String pageUrl) {
        Optional<String> html = fetchPage(pageUrl);
        if (html.isEmpty()) {
            return List.of();
        }
        List<EpisodeEntry> episodes = extract(PageSource.of(html.get())).episodes();
        log.debug("Read {} episodes from page '{}'", episodes.size(), pageUrl);
        return episodes;
    }

    // Mobile user agent: the desktop variant of the page omits the episode payload.
    public Optional<String> fetchPage(String pageUrl) {
        Optional<String> html = httpFetcher.get(
                pageUrl,
                Map.of("User-Agent", properties.effectiveMobileUserAgent()),
                properties.effectivePageTimeout());
        if (html.isEmpty()) {
            log.warn("No page body for '{}'", pageUrl);
        }
        return html;
    }

    public PageExtraction extract(PageSource page) {
        return pipeline.run(page);
    }

    public Optional<String> extractCoverImage(PageSource page) {
        Element meta = page.document().selectFirst("meta[property=og:image]");
        if (meta == null) {
            return Optional.empty();
        }
        String content = meta.attr("content");
        return StringUtils.hasText(content) ? Optional.of(content.trim()) : Optional.empty();
    }

    // Platform-native show id, embedded in the page's hydration JSON.
    public Optional<String> extractShowId(PageSource page) {
        Matcher matcher = SHOW_ID.matcher(page.html());
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
