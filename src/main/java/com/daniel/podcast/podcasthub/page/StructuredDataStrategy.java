package com.daniel.podcast.podcasthub.page;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.nodes.Element;
import org.slf4j.Logger;

import com.daniel.podcast.podcasthub.media.DurationNormalizer;
import com.daniel.podcast.podcasthub.model.EpisodeEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/*
 * Primary path for show pages: the JSON-LD block named "schema:podcast-show".
 *
 * The block lists episodes (workExample entries of type AudioObject) but not their audio files.
 * Audio URLs are scanned from the page text after the block and joined by position:
 * the i-th AudioObject gets the i-th URL, and the join stops at the shorter of the two lists.
 * Scanning only after the block keeps unrelated URLs earlier in the page out of the join.
 */
public class StructuredDataStrategy implements PageExtractionStrategy {

    static final String SHOW_SCHEMA_NAME = "schema:podcast-show";
    // Opening tag of the block itself; a <meta> or attribute text carrying the same name does not match.
    private static final Pattern SCHEMA_SCRIPT_OPEN = Pattern.compile(
            "<script\\b[^>]*\\bname\\s*=\\s*[\"']" + Pattern.quote(SHOW_SCHEMA_NAME) + "[\"'][^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_CLOSE = Pattern.compile("</script\\s*>", Pattern.CASE_INSENSITIVE);
    private static final String AUDIO_OBJECT_TYPE = "AudioObject";

    private final ObjectMapper objectMapper;
    private final AudioUrlScanner audioUrlScanner;
    private final Logger log;

    public StructuredDataStrategy(ObjectMapper objectMapper, AudioUrlScanner audioUrlScanner, Logger log) {
        this.objectMapper = objectMapper;
        this.audioUrlScanner = audioUrlScanner;
        this.log = log;
    }

    @Override
    public Optional<PageExtraction> extract(PageSource page) {
        Optional<String> schemaJson = findSchemaJson(page);
        if (schemaJson.isEmpty()) {
            return Optional.empty();
        }

        JsonNode schema;
        try {
            schema = objectMapper.readTree(schemaJson.get());
        } catch (JsonProcessingException ex) {
            log.warn("Structured data block is not valid JSON: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
        if (schema == null || !schema.isObject()) {
            return Optional.empty();
        }

        List<JsonNode> audioObjects = readAudioObjects(schema);
        List<String> audioUrls = audioUrlScanner.scan(textAfterSchema(page.html()));
        List<EpisodeEntry> episodes = joinByPosition(audioObjects, audioUrls);
        if (episodes.isEmpty()) {
            // Nothing to pair means this page shape is not covered; let the fallback try.
            return Optional.empty();
        }

        return Optional.of(new PageExtraction(
                schema.path("name").asText(""),
                readAuthor(schema.path("author")),
                schema.path("description").asText(""),
                episodes));
    }

    private Optional<String> findSchemaJson(PageSource page) {
        for (Element element : page.document().getElementsByAttributeValue("name", SHOW_SCHEMA_NAME)) {
            if ("script".equalsIgnoreCase(element.tagName())) {
                String data = element.data();
                if (data != null && !data.isBlank()) {
                    return Optional.of(data.trim());
                }
            }
        }
        return Optional.empty();
    }

    private List<JsonNode> readAudioObjects(JsonNode schema) {
        JsonNode examples = schema.path("workExample");
        List<JsonNode> audioObjects = new ArrayList<>();
        if (!examples.isArray()) {
            return audioObjects;
        }
        for (JsonNode example : examples) {
            if (AUDIO_OBJECT_TYPE.equals(example.path("@type").asText())) {
                audioObjects.add(example);
            }
        }
        return audioObjects;
    }

    List<EpisodeEntry> joinByPosition(List<JsonNode> audioObjects, List<String> audioUrls) {
        int pairs = Math.min(audioObjects.size(), audioUrls.size());
        if (audioObjects.size() != audioUrls.size()) {
            log.debug("Structured episodes ({}) and audio URLs ({}) differ; pairing the first {}",
                    audioObjects.size(), audioUrls.size(), pairs);
        }
        List<EpisodeEntry> episodes = new ArrayList<>(pairs);
        for (int i = 0; i < pairs; i++) {
            JsonNode audioObject = audioObjects.get(i);
            String rawPubDate = audioObject.path("datePublished").asText("");
            episodes.add(new EpisodeEntry(
                    audioObject.path("name").asText(""),
                    audioObject.path("description").asText(""),
                    audioUrls.get(i),
                    DurationNormalizer.parse(audioObject.path("duration").asText("")),
                    rawPubDate.isEmpty() ? null : rawPubDate));
        }
        return episodes;
    }

    // author is an object {"name": ...} on most pages, occasionally a plain string or a list.
    private String readAuthor(JsonNode author) {
        if (author.isObject()) {
            return author.path("name").asText("");
        }
        if (author.isArray()) {
            return author.size() > 0 ? readAuthor(author.get(0)) : "";
        }
        if (author.isMissingNode() || author.isNull()) {
            return "";
        }
        return author.asText("");
    }

    private String textAfterSchema(String html) {
        Matcher open = SCHEMA_SCRIPT_OPEN.matcher(html);
        if (!open.find()) {
            return "";
        }
        Matcher close = SCRIPT_CLOSE.matcher(html);
        if (!close.find(open.end())) {
            return "";
        }
        return html.substring(close.end());
    }
}
