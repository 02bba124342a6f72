package com.daniel.podcast.podcasthub.page;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

// Raw page text plus its jsoup tree; strategies need both (regex scans and element lookup).
public record PageSource(String html, Document document) {

    public static PageSource of(String html) {
        String safeHtml = html == null ? "" : html;
        return new PageSource(safeHtml, Jsoup.parse(safeHtml));
    }
}
