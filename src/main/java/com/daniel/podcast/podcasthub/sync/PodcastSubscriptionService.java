package com.daniel.podcast.podcasthub.sync;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.daniel.podcast.podcasthub.detect.PlatformDetector;
import com.daniel.podcast.podcasthub.model.EpisodeEntry;
import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;
import com.daniel.podcast.podcasthub.page.HtmlExtractionEngine;
import com.daniel.podcast.podcasthub.resolve.PodcastLinkResolver;
import com.daniel.podcast.podcasthub.store.PodcastLookup;
import com.daniel.podcast.podcasthub.store.PodcastStore;
import com.daniel.podcast.podcasthub.store.StoredEpisode;
import com.daniel.podcast.podcasthub.store.StoredPodcast;

@Service
public class PodcastSubscriptionService {

    /*
     * Caller side of the engine: resolve -> store -> sync.
     * Sync runs for the same podcast are serialized with one lock per podcast id, because the
     * synchronizer's audio URL snapshot goes stale if two runs interleave.
     * Different podcasts still sync in parallel.
     */
    private static final Logger log = LoggerFactory.getLogger(PodcastSubscriptionService.class);

    private final PodcastLinkResolver linkResolver;
    private final PodcastStore podcastStore;
    private final EpisodeSynchronizer episodeSynchronizer;
    private final HtmlExtractionEngine htmlExtractionEngine;
    private final PlatformDetector platformDetector;
    private final ConcurrentMap<Long, ReentrantLock> syncLocks = new ConcurrentHashMap<>();

    public PodcastSubscriptionService(
            PodcastLinkResolver linkResolver,
            PodcastStore podcastStore,
            EpisodeSynchronizer episodeSynchronizer,
            HtmlExtractionEngine htmlExtractionEngine,
            PlatformDetector platformDetector) {
        this.linkResolver = linkResolver;
        this.podcastStore = podcastStore;
        this.episodeSynchronizer = episodeSynchronizer;
        this.htmlExtractionEngine = htmlExtractionEngine;
        this.platformDetector = platformDetector;
    }

    // Resolution errors (unsupported link, bad id, failed Apple lookup) propagate to the caller.
    public SubscriptionResult subscribe(String url) {
        PodcastInfo info = linkResolver.resolve(url);

        PodcastLookup lookup = podcastStore.getOrCreatePodcast(info);
        StoredPodcast podcast = lookup.podcast();
        if (!lookup.created()) {
            log.info("Podcast already subscribed: id={}, feedUrl={}", podcast.id(), podcast.feedUrl());
            return new SubscriptionResult(podcast, true);
        }

        if (info.platform() == PlatformTag.SPOTIFY) {
            // Nothing to fetch: the stub carries no feed.
            return new SubscriptionResult(podcast, false);
        }

        // Resolvers that already downloaded the feed or page hand over that batch; otherwise sync fetches it.
        List<EpisodeEntry> prefetched = info.hasEpisodes() ? info.episodes() : null;
        withSyncLock(podcast.id(), () -> episodeSynchronizer.sync(podcast.id(), info.feedUrl(), prefetched));
        return new SubscriptionResult(reload(podcast.id()), false);
    }

    /*
     * Xiaoyuzhou share pages list episodes the canonical feed may lag on, so the page is re-read
     * first. Everything else passes no batch and lets the synchronizer fetch the feed.
     */
    public StoredPodcast refresh(long podcastId) {
        StoredPodcast podcast = reload(podcastId);

        withSyncLock(podcastId, () -> {
            List<EpisodeEntry> batch = platformDetector.detect(podcast.sourceUrl()) == PlatformTag.XIAOYUZHOU
                    ? htmlExtractionEngine.listEpisodesFromPage(podcast.sourceUrl())
                    : List.of();
            episodeSynchronizer.sync(podcastId, podcast.feedUrl(), batch);
        });
        return reload(podcastId);
    }

    /*
     * Removes the podcast with its episodes, favorite mark and play history.
     * Runs under the podcast's sync lock so a delete never lands in the middle of a sync run;
     * the lock itself is dropped afterwards.
     */
    public void unsubscribe(long podcastId) {
        try {
            withSyncLock(podcastId, () -> {
                if (!podcastStore.deletePodcast(podcastId)) {
                    throw new PodcastNotFoundException(podcastId);
                }
            });
        } finally {
            syncLocks.remove(podcastId);
        }
        log.info("Unsubscribed podcast {}", podcastId);
    }

    public List<StoredPodcast> podcasts() {
        return podcastStore.listPodcasts();
    }

    public List<StoredEpisode> episodes(long podcastId) {
        reload(podcastId);
        return podcastStore.listEpisodes(podcastId);
    }

    private StoredPodcast reload(long podcastId) {
        return podcastStore.findPodcast(podcastId)
                .orElseThrow(() -> new PodcastNotFoundException(podcastId));
    }

    boolean hasSyncLock(long podcastId) {
        return syncLocks.containsKey(podcastId);
    }

    private void withSyncLock(long podcastId, Runnable action) {
        ReentrantLock lock = syncLocks.computeIfAbsent(podcastId, id -> new ReentrantLock());
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
