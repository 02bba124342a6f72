package com.daniel.podcast.podcasthub.store;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Repository;

import com.daniel.podcast.podcasthub.model.PodcastInfo;

@Repository
// Process-local store; every public method is synchronized on the instance.
public class InMemoryPodcastStore implements PodcastStore {

    private final Clock clock;
    private final AtomicLong podcastIds = new AtomicLong();
    private final AtomicLong episodeIds = new AtomicLong();
    private final AtomicLong playIds = new AtomicLong();
    private final Map<Long, StoredPodcast> podcasts = new LinkedHashMap<>();
    private final Map<String, Long> podcastIdsByFeedUrl = new HashMap<>();
    private final Map<Long, List<StoredEpisode>> episodesByPodcast = new HashMap<>();
    private final Map<Long, Set<String>> audioUrlsByPodcast = new HashMap<>();
    private final Map<Long, Long> podcastIdsByEpisode = new HashMap<>();
    // Insertion order is favorite order; re-adding moves a podcast to the end.
    private final Set<Long> favoritePodcastIds = new LinkedHashSet<>();
    private final List<PlayRecord> playHistory = new ArrayList<>();

    public InMemoryPodcastStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized PodcastLookup getOrCreatePodcast(PodcastInfo info) {
        Long existingId = podcastIdsByFeedUrl.get(info.feedUrl());
        if (existingId != null) {
            return new PodcastLookup(podcasts.get(existingId), false);
        }

        Instant now = clock.instant();
        StoredPodcast podcast = new StoredPodcast(
                podcastIds.incrementAndGet(),
                info.platform(),
                info.title(),
                info.description(),
                info.imageUrl(),
                info.feedUrl(),
                info.sourceUrl(),
                info.author(),
                info.category(),
                info.episodeCount(),
                now,
                now);
        podcasts.put(podcast.id(), podcast);
        podcastIdsByFeedUrl.put(podcast.feedUrl(), podcast.id());
        episodesByPodcast.put(podcast.id(), new ArrayList<>());
        audioUrlsByPodcast.put(podcast.id(), new HashSet<>());
        return new PodcastLookup(podcast, true);
    }

    @Override
    public synchronized Optional<StoredPodcast> findPodcast(long podcastId) {
        return Optional.ofNullable(podcasts.get(podcastId));
    }

    // Most recently updated first, like the subscription list view.
    @Override
    public synchronized List<StoredPodcast> listPodcasts() {
        return podcasts.values().stream()
                .sorted(Comparator.comparing(StoredPodcast::updatedAt).reversed()
                        .thenComparing(Comparator.comparingLong(StoredPodcast::id).reversed()))
                .toList();
    }

    @Override
    public synchronized void updateEpisodeCount(long podcastId, int episodeCount) {
        StoredPodcast podcast = requirePodcast(podcastId);
        podcasts.put(podcastId, podcast.withEpisodeCount(episodeCount, clock.instant()));
    }

    @Override
    public synchronized Set<String> listAudioUrls(long podcastId) {
        requirePodcast(podcastId);
        return Set.copyOf(audioUrlsByPodcast.get(podcastId));
    }

    @Override
    public synchronized boolean insertEpisode(long podcastId, NewEpisode episode) {
        requirePodcast(podcastId);
        if (!audioUrlsByPodcast.get(podcastId).add(episode.audioUrl())) {
            return false;
        }
        long episodeId = episodeIds.incrementAndGet();
        episodesByPodcast.get(podcastId).add(new StoredEpisode(
                episodeId,
                podcastId,
                episode.title(),
                episode.description(),
                episode.audioUrl(),
                episode.durationSeconds(),
                episode.pubDate(),
                episode.episodeNum(),
                clock.instant(),
                false,
                0,
                null));
        podcastIdsByEpisode.put(episodeId, podcastId);
        return true;
    }

    @Override
    public synchronized List<StoredEpisode> listEpisodes(long podcastId) {
        requirePodcast(podcastId);
        return episodesByPodcast.get(podcastId).stream()
                .sorted(Comparator.comparing(StoredEpisode::pubDate, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(StoredEpisode::id))
                .toList();
    }

    @Override
    public synchronized boolean deletePodcast(long podcastId) {
        StoredPodcast podcast = podcasts.remove(podcastId);
        if (podcast == null) {
            return false;
        }
        podcastIdsByFeedUrl.remove(podcast.feedUrl());
        for (StoredEpisode episode : episodesByPodcast.remove(podcastId)) {
            podcastIdsByEpisode.remove(episode.id());
        }
        audioUrlsByPodcast.remove(podcastId);
        favoritePodcastIds.remove(podcastId);
        playHistory.removeIf(play -> play.podcastId() == podcastId);
        return true;
    }

    @Override
    public synchronized Optional<StoredEpisode> findEpisode(long episodeId) {
        Long podcastId = podcastIdsByEpisode.get(episodeId);
        if (podcastId == null) {
            return Optional.empty();
        }
        List<StoredEpisode> episodes = episodesByPodcast.get(podcastId);
        return Optional.of(episodes.get(indexOfEpisode(episodes, episodeId)));
    }

    @Override
    public synchronized PlayRecord recordPlay(long episodeId) {
        StoredEpisode played = replaceEpisode(episodeId, StoredEpisode::markPlayed);
        PlayRecord play = new PlayRecord(
                playIds.incrementAndGet(),
                episodeId,
                played.podcastId(),
                clock.instant(),
                0,
                played.durationSeconds());
        playHistory.add(play);
        return play;
    }

    @Override
    public synchronized StoredEpisode updateProgress(long episodeId, int progressSeconds) {
        Instant now = clock.instant();
        return replaceEpisode(episodeId, episode -> episode.withProgress(progressSeconds, now));
    }

    @Override
    public synchronized List<PlayRecord> listPlayHistory() {
        return playHistory.stream()
                .sorted(Comparator.comparing(PlayRecord::playedAt).reversed()
                        .thenComparing(Comparator.comparingLong(PlayRecord::id).reversed()))
                .toList();
    }

    @Override
    public synchronized boolean addFavorite(long podcastId) {
        requirePodcast(podcastId);
        return favoritePodcastIds.add(podcastId);
    }

    @Override
    public synchronized boolean removeFavorite(long podcastId) {
        return favoritePodcastIds.remove(podcastId);
    }

    @Override
    public synchronized List<StoredPodcast> listFavorites() {
        List<StoredPodcast> favorites = new ArrayList<>(favoritePodcastIds.size());
        for (Long podcastId : favoritePodcastIds) {
            favorites.add(0, podcasts.get(podcastId));
        }
        return List.copyOf(favorites);
    }

    private StoredEpisode replaceEpisode(long episodeId, UnaryOperator<StoredEpisode> change) {
        Long podcastId = podcastIdsByEpisode.get(episodeId);
        if (podcastId == null) {
            throw new IllegalArgumentException("Unknown episode id " + episodeId);
        }
        List<StoredEpisode> episodes = episodesByPodcast.get(podcastId);
        int index = indexOfEpisode(episodes, episodeId);
        StoredEpisode changed = change.apply(episodes.get(index));
        episodes.set(index, changed);
        return changed;
    }

    private int indexOfEpisode(List<StoredEpisode> episodes, long episodeId) {
        for (int i = 0; i < episodes.size(); i++) {
            if (episodes.get(i).id() == episodeId) {
                return i;
            }
        }
        throw new IllegalStateException("Episode index out of sync for id " + episodeId);
    }

    private StoredPodcast requirePodcast(long podcastId) {
        StoredPodcast podcast = podcasts.get(podcastId);
        if (podcast == null) {
            throw new IllegalArgumentException("Unknown podcast id " + podcastId);
        }
        return podcast;
    }
}
