package com.daniel.podcast.podcasthub.resolve;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.daniel.podcast.podcasthub.config.PodcastHubProperties;
import com.daniel.podcast.podcasthub.model.EpisodeEntry;
import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;
import com.daniel.podcast.podcasthub.page.HtmlExtractionEngine;
import com.daniel.podcast.podcasthub.page.PageExtraction;
import com.daniel.podcast.podcasthub.page.PageSource;

@Component
public class XiaoyuzhouResolver implements PodcastResolver {

    /*
     * Xiaoyuzhou share pages are scraped directly:
     * - title/author/episodes from the page strategies (structured data, then quoted fields)
     * - cover from og:image
     * - canonical feed from the embedded show id, or the share link when the id is missing
     * A page that cannot be downloaded still yields a best-effort PodcastInfo with no episodes.
     */
    private static final Logger log = LoggerFactory.getLogger(XiaoyuzhouResolver.class);
    static final String UNKNOWN_TITLE = "Unknown podcast";

    private final HtmlExtractionEngine htmlExtractionEngine;
    private final PodcastHubProperties properties;

    public XiaoyuzhouResolver(HtmlExtractionEngine htmlExtractionEngine, PodcastHubProperties properties) {
        this.htmlExtractionEngine = htmlExtractionEngine;
        this.properties = properties;
    }

    @Override
    public PlatformTag platform() {
        return PlatformTag.XIAOYUZHOU;
    }

    @Override
    public PodcastInfo resolve(String url) {
        String html = htmlExtractionEngine.fetchPage(url).orElse("");
        PageSource page = PageSource.of(html);

        PageExtraction extraction = htmlExtractionEngine.extract(page);
        List<EpisodeEntry> episodes = extraction.episodes();
        String imageUrl = htmlExtractionEngine.extractCoverImage(page).orElse("");
        String feedUrl = htmlExtractionEngine.extractShowId(page)
                .map(showId -> properties.normalizedXiaoyuzhouFeedPrefix() + showId)
                .orElse(url);
        if (feedUrl.equals(url)) {
            log.debug("No show id on '{}'; keeping the share link as feed URL", url);
        }

        return new PodcastInfo(
                PlatformTag.XIAOYUZHOU,
                StringUtils.hasText(extraction.title()) ? extraction.title() : UNKNOWN_TITLE,
                extraction.description(),
                imageUrl,
                feedUrl,
                url,
                extraction.author(),
                PlatformTag.XIAOYUZHOU.displayName(),
                episodes.size(),
                episodes);
    }
}
