package com.daniel.podcast.podcasthub.store;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;

class InMemoryPodcastStoreTests {

    private final InMemoryPodcastStore store =
            new InMemoryPodcastStore(Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));

    // Feed URL is the podcast key: a second subscribe finds the first row.
    @Test
    void getOrCreateIsKeyedByFeedUrl() {
        PodcastLookup first = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml"));
        PodcastLookup second = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml"));

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.podcast().id(), second.podcast().id());
        assertEquals(1, store.listPodcasts().size());
    }

    @Test
    void audioUrlsAreUniquePerPodcast() {
        long a = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast().id();
        long b = store.getOrCreatePodcast(info("https://feeds.example.com/b.xml")).podcast().id();

        assertTrue(store.insertEpisode(a, episode("x.mp3", "2024-01-01T00:00:00Z")));
        assertFalse(store.insertEpisode(a, episode("x.mp3", "2024-02-01T00:00:00Z")));
        // Same URL under another podcast is a different episode.
        assertTrue(store.insertEpisode(b, episode("x.mp3", "2024-01-01T00:00:00Z")));

        assertThat(store.listAudioUrls(a), containsInAnyOrder("x.mp3"));
        assertEquals(1, store.listEpisodes(a).size());
    }

    @Test
    void episodesAreNewestFirst() {
        long id = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast().id();
        store.insertEpisode(id, episode("old.mp3", "2024-01-01T00:00:00Z"));
        store.insertEpisode(id, episode("new.mp3", "2024-03-01T00:00:00Z"));
        store.insertEpisode(id, episode("mid.mp3", "2024-02-01T00:00:00Z"));

        List<String> order = store.listEpisodes(id).stream().map(StoredEpisode::audioUrl).toList();

        assertThat(order, contains("new.mp3", "mid.mp3", "old.mp3"));
    }

    @Test
    void updateEpisodeCountReplacesValue() {
        StoredPodcast podcast = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast();

        store.updateEpisodeCount(podcast.id(), 12);

        assertEquals(12, store.findPodcast(podcast.id()).orElseThrow().episodeCount());
    }

    @Test
    void unknownPodcastIsRejected() {
        assertTrue(store.findPodcast(404).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.updateEpisodeCount(404, 1));
        assertThrows(IllegalArgumentException.class, () -> store.listAudioUrls(404));
    }

    @Test
    void audioUrlSnapshotIsACopy() {
        long id = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast().id();
        store.insertEpisode(id, episode("x.mp3", "2024-01-01T00:00:00Z"));

        assertThrows(UnsupportedOperationException.class, () -> store.listAudioUrls(id).add("y.mp3"));
        assertSame(PlatformTag.RSS, store.findPodcast(id).orElseThrow().platform());
    }

    // Delete frees the feed URL key: subscribing again creates a new row with a new id.
    @Test
    void deletePodcastRemovesEverythingKeyedOnIt() {
        long id = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast().id();
        store.insertEpisode(id, episode("x.mp3", "2024-01-01T00:00:00Z"));
        long episodeId = store.listEpisodes(id).get(0).id();
        store.addFavorite(id);
        store.recordPlay(episodeId);

        assertTrue(store.deletePodcast(id));

        assertTrue(store.findPodcast(id).isEmpty());
        assertTrue(store.findEpisode(episodeId).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.listAudioUrls(id));
        assertTrue(store.listFavorites().isEmpty());
        assertTrue(store.listPlayHistory().isEmpty());

        PodcastLookup again = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml"));
        assertTrue(again.created());
        assertTrue(again.podcast().id() > id);
        assertTrue(store.listAudioUrls(again.podcast().id()).isEmpty());
    }

    @Test
    void deleteUnknownPodcastReportsFalse() {
        assertFalse(store.deletePodcast(404));
    }

    // Other podcasts' history survives a delete.
    @Test
    void deleteKeepsOtherPodcastsHistory() {
        long a = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast().id();
        long b = store.getOrCreatePodcast(info("https://feeds.example.com/b.xml")).podcast().id();
        store.insertEpisode(a, episode("a.mp3", "2024-01-01T00:00:00Z"));
        store.insertEpisode(b, episode("b.mp3", "2024-01-01T00:00:00Z"));
        store.recordPlay(store.listEpisodes(a).get(0).id());
        store.recordPlay(store.listEpisodes(b).get(0).id());

        store.deletePodcast(a);

        assertThat(store.listPlayHistory().stream().map(PlayRecord::podcastId).toList(), contains(b));
    }

    @Test
    void recordPlayMarksEpisodeAndCopiesDuration() {
        long id = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast().id();
        store.insertEpisode(id, episode("x.mp3", "2024-01-01T00:00:00Z"));
        long episodeId = store.listEpisodes(id).get(0).id();

        PlayRecord first = store.recordPlay(episodeId);
        PlayRecord second = store.recordPlay(episodeId);

        assertTrue(store.findEpisode(episodeId).orElseThrow().played());
        assertEquals(60, first.durationSeconds());
        assertEquals(0, first.progressSeconds());
        assertEquals(id, first.podcastId());
        // Same instant from the fixed clock, so the later row wins on id.
        assertThat(store.listPlayHistory(), contains(second, first));
    }

    @Test
    void updateProgressStampsPlayedAt() {
        long id = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast().id();
        store.insertEpisode(id, episode("x.mp3", "2024-01-01T00:00:00Z"));
        long episodeId = store.listEpisodes(id).get(0).id();

        StoredEpisode updated = store.updateProgress(episodeId, 90);

        assertEquals(90, updated.progressSeconds());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), updated.playedAt());
        assertFalse(updated.played());
        assertEquals(updated, store.listEpisodes(id).get(0));
        assertThrows(IllegalArgumentException.class, () -> store.updateProgress(999, 1));
    }

    @Test
    void favoritesAreNewestFirstAndUnique() {
        long a = store.getOrCreatePodcast(info("https://feeds.example.com/a.xml")).podcast().id();
        long b = store.getOrCreatePodcast(info("https://feeds.example.com/b.xml")).podcast().id();

        assertTrue(store.addFavorite(a));
        assertTrue(store.addFavorite(b));
        assertFalse(store.addFavorite(a));

        assertThat(store.listFavorites().stream().map(StoredPodcast::id).toList(), contains(b, a));
        assertTrue(store.removeFavorite(b));
        assertFalse(store.removeFavorite(b));
        assertThat(store.listFavorites().stream().map(StoredPodcast::id).toList(), contains(a));
        assertThrows(IllegalArgumentException.class, () -> store.addFavorite(404));
    }

    private PodcastInfo info(String feedUrl) {
        return new PodcastInfo(PlatformTag.RSS, "Show", "", "", feedUrl, feedUrl, "", "RSS", 0, List.of());
    }

    private NewEpisode episode(String audioUrl, String pubDate) {
        return new NewEpisode("Episode", "", audioUrl, 60, Instant.parse(pubDate), 0);
    }
}
