package com.daniel.podcast.podcasthub.page;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.daniel.podcast.podcasthub.model.EpisodeEntry;

/*
 * Last-resort reading of a show page when no structured data yields episodes.
 * Show title and author come from the first quoted "title"/"author" fields in the embedded JSON.
 * Every audio URL in the page becomes an episode titled by the closest "title" field before it.
 * Always produces a result, possibly with no episodes.
 */
public class QuotedFieldFallbackStrategy implements PageExtractionStrategy {

    private static final Pattern SHOW_TITLE = Pattern.compile("\"title\":\"([^\"]{5,100})\"");
    private static final Pattern AUTHOR = Pattern.compile("\"author\":\"([^\"]*)\"");
    private static final Pattern ANY_TITLE = Pattern.compile("\"title\":\"([^\"]+)\"");

    private record TitleField(String title, int position) {
    }

    private final AudioUrlScanner audioUrlScanner;

    public QuotedFieldFallbackStrategy(AudioUrlScanner audioUrlScanner) {
        this.audioUrlScanner = audioUrlScanner;
    }

    @Override
    public Optional<PageExtraction> extract(PageSource page) {
        String html = page.html();
        String showTitle = firstGroup(SHOW_TITLE, html);
        String author = firstGroup(AUTHOR, html);

        List<TitleField> titleFields = findTitleFields(html);
        List<EpisodeEntry> episodes = new ArrayList<>();
        for (AudioUrlScanner.Hit hit : audioUrlScanner.find(html)) {
            String title = closestTitleBefore(titleFields, hit.position());
            episodes.add(EpisodeEntry.titleAndAudio(title.isEmpty() ? showTitle : title, hit.url()));
        }

        return Optional.of(new PageExtraction(showTitle, author, "", episodes));
    }

    private List<TitleField> findTitleFields(String html) {
        List<TitleField> fields = new ArrayList<>();
        Matcher matcher = ANY_TITLE.matcher(html);
        while (matcher.find()) {
            fields.add(new TitleField(matcher.group(1), matcher.start()));
        }
        return fields;
    }

    // titleFields is in document order, so the last one before the URL is the closest.
    private String closestTitleBefore(List<TitleField> titleFields, int position) {
        String closest = "";
        for (TitleField field : titleFields) {
            if (field.position() >= position) {
                break;
            }
            closest = field.title();
        }
        return closest;
    }

    private String firstGroup(Pattern pattern, String html) {
        Matcher matcher = pattern.matcher(html);
        return matcher.find() ? matcher.group(1) : "";
    }
}
