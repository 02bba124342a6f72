package com.daniel.podcast.podcasthub.feed;

import java.io.IOException;
import java.io.StringReader; // The body is already decoded as UTF-8.
import java.util.ArrayList;
import java.util.Date; // Rome exposes parsed item dates as java.util.Date.
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jdom2.Document; // Parsed once, then handed to Rome and read for raw item fields.
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.Namespace;
import org.jdom2.input.SAXBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.daniel.podcast.podcasthub.config.PodcastHubProperties;
import com.daniel.podcast.podcasthub.fetch.HttpFetcher;
import com.daniel.podcast.podcasthub.media.DurationNormalizer;
import com.daniel.podcast.podcasthub.model.EpisodeEntry;
import com.daniel.podcast.podcasthub.resolve.UpstreamParseException;
import com.rometools.modules.itunes.EntryInformation; // iTunes item-level module (itunes:duration).
import com.rometools.modules.itunes.ITunes; // Namespace URI used to look the module up.
import com.rometools.rome.feed.module.Module;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput; // Parses RSS 0.9x/1.0/2.0 and Atom into one SyndFeed model.

@Service
public class FeedExtractionEngine {

    /*
     * Reads RSS/Atom feeds into EpisodeEntry lists.
     * This is the one place where upstream failures for feed sources degrade silently:
     * - transport error / non-2xx -> empty list
     * - body that Rome cannot parse -> empty list
     * Both are logged at WARN through the injected logger.
     */
    private final HttpFetcher httpFetcher;
    private final PodcastHubProperties properties;
    private final Logger log;

    @Autowired
    public FeedExtractionEngine(HttpFetcher httpFetcher, PodcastHubProperties properties) {
        this(httpFetcher, properties, LoggerFactory.getLogger(FeedExtractionEngine.class));
    }

    public FeedExtractionEngine(HttpFetcher httpFetcher, PodcastHubProperties properties, Logger log) {
        this.httpFetcher = httpFetcher;
        this.properties = properties;
        this.log = log;
    }

    public List<EpisodeEntry> listEpisodes(String feedUrl) {
        return fetchFeed(feedUrl)
                .map(FetchedFeed::entries)
                .orElse(List.of());
    }

    // Used by the RSS resolver, which also needs channel-level fields and the raw markup.
    public Optional<FetchedFeed> fetchFeed(String feedUrl) {
        Optional<String> body = httpFetcher.get(
                feedUrl,
                Map.of("User-Agent", properties.effectiveDesktopUserAgent()),
                properties.effectiveFeedTimeout());
        if (body.isEmpty()) {
            log.warn("No feed body for '{}'; returning no episodes", feedUrl);
            return Optional.empty();
        }

        try {
            return Optional.of(parse(body.get()));
        } catch (UpstreamParseException ex) {
            log.warn("Skipping unparsable feed '{}': {}", feedUrl, ex.getMessage());
            return Optional.empty();
        }
    }

    public FetchedFeed parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new UpstreamParseException("Feed body is empty", null);
        }
        try {
            // Leading whitespace before the XML declaration makes the SAX parser reject the document.
            Document document = newSaxBuilder().build(new StringReader(xml.stripLeading()));
            List<String> rawDurations = readRawDurations(document);
            SyndFeed feed = new SyndFeedInput().build(document);

            List<SyndEntry> syndEntries = feed.getEntries();
            boolean aligned = rawDurations.size() == syndEntries.size();
            List<EpisodeEntry> entries = new ArrayList<>(syndEntries.size());
            for (int i = 0; i < syndEntries.size(); i++) {
                SyndEntry entry = syndEntries.get(i);
                String rawDuration = aligned ? rawDurations.get(i) : readModuleDuration(entry);
                entries.add(toEpisodeEntry(entry, rawDuration));
            }
            return new FetchedFeed(xml, feed, entries);
        } catch (JDOMException | IOException | FeedException | RuntimeException ex) {
            throw new UpstreamParseException("Feed body is not valid RSS/Atom: " + ex.getMessage(), ex);
        }
    }

    // No DOCTYPE and no entity expansion, as in Rome's own builder.
    private SAXBuilder newSaxBuilder() {
        SAXBuilder builder = new SAXBuilder();
        builder.setExpandEntities(false);
        builder.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        return builder;
    }

    private EpisodeEntry toEpisodeEntry(SyndEntry entry, String rawDuration) {
        return new EpisodeEntry(
                trimToEmpty(entry.getTitle()),
                readDescription(entry),
                readFirstEnclosureUrl(entry),
                DurationNormalizer.parse(rawDuration),
                readRawPubDate(entry));
    }

    // Atom entries often carry <content> instead of <summary>.
    private String readDescription(SyndEntry entry) {
        SyndContent description = entry.getDescription();
        if (description != null && description.getValue() != null) {
            return description.getValue().trim();
        }
        List<SyndContent> contents = entry.getContents();
        if (contents != null && !contents.isEmpty() && contents.get(0).getValue() != null) {
            return contents.get(0).getValue().trim();
        }
        return "";
    }

    // Entries without an enclosure keep an empty audio URL; sync treats "" like any other key.
    private String readFirstEnclosureUrl(SyndEntry entry) {
        List<SyndEnclosure> enclosures = entry.getEnclosures();
        if (enclosures == null || enclosures.isEmpty()) {
            return "";
        }
        return trimToEmpty(enclosures.get(0).getUrl());
    }

    /*
     * Raw duration text per <item>/<entry>, in document order (the order Rome lists entries in).
     * The iTunes module only understands clock strings and drops ISO values like PT1H2M3S,
     * so the text is read from the document and normalized here.
     * itunes:duration wins over a <duration> element from any other namespace.
     */
    private List<String> readRawDurations(Document document) {
        Element root = document.getRootElement();
        List<String> durations = new ArrayList<>();
        collectItemDurations(root, root, durations);
        return durations;
    }

    private void collectItemDurations(Element root, Element parent, List<String> durations) {
        for (Element child : parent.getChildren()) {
            String name = child.getName();
            if ("item".equals(name) || "entry".equals(name)) {
                durations.add(readDurationChild(child));
            } else if (parent == root && "channel".equals(name)) {
                collectItemDurations(root, child, durations);
            }
        }
    }

    private String readDurationChild(Element item) {
        Element iTunesDuration = item.getChild("duration", Namespace.getNamespace(ITunes.URI));
        if (iTunesDuration != null) {
            return iTunesDuration.getTextTrim();
        }
        for (Element child : item.getChildren()) {
            if ("duration".equalsIgnoreCase(child.getName())) {
                return child.getTextTrim();
            }
        }
        return null;
    }

    // Fallback when items and entries cannot be paired by position.
    private String readModuleDuration(SyndEntry entry) {
        Module module = entry.getModule(ITunes.URI);
        if (module instanceof EntryInformation) {
            EntryInformation iTunes = (EntryInformation) module;
            if (iTunes.getDuration() != null) {
                return Long.toString(iTunes.getDuration().getMilliseconds() / 1000L);
            }
        }
        return null;
    }

    // Rome has already parsed the date, so the "raw" value is its ISO-8601 rendering.
    private String readRawPubDate(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date == null ? null : date.toInstant().toString();
    }

    private String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
