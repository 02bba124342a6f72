package com.daniel.podcast.podcasthub.sync;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.daniel.podcast.podcasthub.detect.PlatformDetector;
import com.daniel.podcast.podcasthub.feed.FeedExtractionEngine;
import com.daniel.podcast.podcasthub.media.PublishDateParser;
import com.daniel.podcast.podcasthub.model.EpisodeEntry;
import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.page.HtmlExtractionEngine;
import com.daniel.podcast.podcasthub.store.NewEpisode;
import com.daniel.podcast.podcasthub.store.PodcastStore;

@Service
public class EpisodeSynchronizer {

    /*
     * Merges one fetched episode batch into the stored episode set of a podcast.
     *
     * Contract:
     * - episodeCount is overwritten with the batch size, even when every entry was already stored
     *   (and even when a failed fetch produced an empty batch)
     * - existing audio URLs are read once per run; URLs inserted during the run are added to that
     *   snapshot, so a batch that repeats a URL still inserts it once
     * - nothing escapes sync(): any failure is logged and the run counts as a no-op
     *
     * Not safe to run twice at once for the same podcast; PodcastSubscriptionService serializes that.
     */
    static final int EPISODE_NUM_PLACEHOLDER = 0;

    private final PodcastStore podcastStore;
    private final FeedExtractionEngine feedExtractionEngine;
    private final HtmlExtractionEngine htmlExtractionEngine;
    private final PlatformDetector platformDetector;
    private final Clock clock;
    private final Logger log;

    @Autowired
    public EpisodeSynchronizer(
            PodcastStore podcastStore,
            FeedExtractionEngine feedExtractionEngine,
            HtmlExtractionEngine htmlExtractionEngine,
            PlatformDetector platformDetector,
            Clock clock) {
        this(podcastStore, feedExtractionEngine, htmlExtractionEngine, platformDetector, clock,
                LoggerFactory.getLogger(EpisodeSynchronizer.class));
    }

    public EpisodeSynchronizer(
            PodcastStore podcastStore,
            FeedExtractionEngine feedExtractionEngine,
            HtmlExtractionEngine htmlExtractionEngine,
            PlatformDetector platformDetector,
            Clock clock,
            Logger log) {
        this.podcastStore = podcastStore;
        this.feedExtractionEngine = feedExtractionEngine;
        this.htmlExtractionEngine = htmlExtractionEngine;
        this.platformDetector = platformDetector;
        this.clock = clock;
        this.log = log;
    }

    public void sync(long podcastId, String feedUrl, List<EpisodeEntry> prefetchedBatch) {
        try {
            List<EpisodeEntry> batch = prefetchedBatch != null && !prefetchedBatch.isEmpty()
                    ? prefetchedBatch
                    : fetchBatch(feedUrl);

            podcastStore.updateEpisodeCount(podcastId, batch.size());

            Set<String> knownAudioUrls = new HashSet<>(podcastStore.listAudioUrls(podcastId));
            int inserted = 0;
            for (EpisodeEntry entry : batch) {
                if (knownAudioUrls.contains(entry.audioUrl())) {
                    continue;
                }
                // Feed position is not a reliable episode number; ordering comes from pubDate.
                NewEpisode episode = new NewEpisode(
                        entry.title(),
                        entry.description(),
                        entry.audioUrl(),
                        entry.durationSeconds(),
                        PublishDateParser.parseOrNow(entry.rawPubDate(), clock),
                        EPISODE_NUM_PLACEHOLDER);
                if (podcastStore.insertEpisode(podcastId, episode)) {
                    inserted++;
                }
                knownAudioUrls.add(entry.audioUrl());
            }

            log.info("Synced episodes: podcastId={}, batch={}, inserted={}", podcastId, batch.size(), inserted);
        } catch (RuntimeException ex) {
            log.error("Failed to sync episodes for podcast {} from '{}'", podcastId, feedUrl, ex);
        }
    }

    // Share pages on Xiaoyuzhou are their own episode source; everything else is a feed.
    private List<EpisodeEntry> fetchBatch(String feedUrl) {
        if (platformDetector.detect(feedUrl) == PlatformTag.XIAOYUZHOU) {
            return htmlExtractionEngine.listEpisodesFromPage(feedUrl);
        }
        return feedExtractionEngine.listEpisodes(feedUrl);
    }
}
