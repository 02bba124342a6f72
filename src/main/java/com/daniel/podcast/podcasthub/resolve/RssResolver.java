package com.daniel.podcast.podcasthub.resolve;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.daniel.podcast.podcasthub.feed.FeedCoverResolver;
import com.daniel.podcast.podcasthub.feed.FeedExtractionEngine;
import com.daniel.podcast.podcasthub.feed.FetchedFeed;
import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;
import com.rometools.modules.itunes.FeedInformation;
import com.rometools.modules.itunes.ITunes;
import com.rometools.rome.feed.module.Module;
import com.rometools.rome.feed.synd.SyndFeed;

@Component
// Generic RSS/Atom links: the link already is the feed, so it doubles as canonical feed URL.
public class RssResolver implements PodcastResolver {

    static final String UNKNOWN_TITLE = "Unknown podcast";
    static final String STUB_TITLE = "RSS podcast";
    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private final FeedExtractionEngine feedExtractionEngine;
    private final FeedCoverResolver feedCoverResolver;

    public RssResolver(FeedExtractionEngine feedExtractionEngine, FeedCoverResolver feedCoverResolver) {
        this.feedExtractionEngine = feedExtractionEngine;
        this.feedCoverResolver = feedCoverResolver;
    }

    @Override
    public PlatformTag platform() {
        return PlatformTag.RSS;
    }

    @Override
    public PodcastInfo resolve(String url) {
        Optional<FetchedFeed> fetched = feedExtractionEngine.fetchFeed(url);
        if (fetched.isEmpty()) {
            // Fetch/parse problems were already logged by the engine.
            return stub(url);
        }

        FetchedFeed feed = fetched.get();
        SyndFeed syndFeed = feed.feed();
        String title = StringUtils.hasText(syndFeed.getTitle()) ? syndFeed.getTitle().trim() : UNKNOWN_TITLE;

        // Entries were parsed along with the channel, so they travel as the pre-fetched batch.
        return new PodcastInfo(
                PlatformTag.RSS,
                title,
                truncate(syndFeed.getDescription()),
                feedCoverResolver.resolve(url, feed),
                url,
                url,
                readAuthor(syndFeed),
                PlatformTag.RSS.displayName(),
                feed.entries().size(),
                feed.entries());
    }

    private PodcastInfo stub(String url) {
        return new PodcastInfo(
                PlatformTag.RSS,
                STUB_TITLE,
                "",
                feedCoverResolver.resolve(url, null),
                url,
                url,
                "",
                PlatformTag.RSS.displayName(),
                0,
                List.of());
    }

    private String readAuthor(SyndFeed feed) {
        if (StringUtils.hasText(feed.getAuthor())) {
            return feed.getAuthor().trim();
        }
        Module module = feed.getModule(ITunes.URI);
        if (module instanceof FeedInformation) {
            String author = ((FeedInformation) module).getAuthor();
            return author == null ? "" : author.trim();
        }
        return "";
    }

    private String truncate(String description) {
        if (description == null) {
            return "";
        }
        String trimmed = description.trim();
        return trimmed.length() > MAX_DESCRIPTION_LENGTH ? trimmed.substring(0, MAX_DESCRIPTION_LENGTH) : trimmed;
    }
}
