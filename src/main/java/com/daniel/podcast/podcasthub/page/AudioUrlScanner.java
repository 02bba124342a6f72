package com.daniel.podcast.podcasthub.page;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Finds quoted CDN audio URLs in page text, deduplicated in first-seen order.
public class AudioUrlScanner {

    public record Hit(String url, int position) {
    }

    private final Pattern audioUrlPattern;

    public AudioUrlScanner(String cdnHost) {
        this.audioUrlPattern = Pattern.compile(
                "\"(https://" + Pattern.quote(cdnHost) + "/[^\"]+\\.(?:m4a|mp3)[^\"]*)\"");
    }

    public List<String> scan(String text) {
        return find(text).stream()
                .map(Hit::url)
                .toList();
    }

    // Position is where the first occurrence starts; later repeats of the same URL are dropped.
    public List<Hit> find(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> firstSeen = new LinkedHashMap<>();
        Matcher matcher = audioUrlPattern.matcher(text);
        while (matcher.find()) {
            firstSeen.putIfAbsent(matcher.group(1), matcher.start());
        }
        List<Hit> hits = new ArrayList<>(firstSeen.size());
        firstSeen.forEach((url, position) -> hits.add(new Hit(url, position)));
        return hits;
    }
}
