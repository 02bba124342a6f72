package com.daniel.podcast.podcasthub.listening;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.daniel.podcast.podcasthub.store.PlayRecord;
import com.daniel.podcast.podcasthub.store.PodcastStore;
import com.daniel.podcast.podcasthub.store.StoredEpisode;
import com.daniel.podcast.podcasthub.store.StoredPodcast;
import com.daniel.podcast.podcasthub.sync.PodcastNotFoundException;

@Service
public class ListeningService {

    /*
     * Listener-side state kept next to the synced catalogue:
     * - plays (episode marked played + one history row per play)
     * - playback progress per episode
     * - favorite podcasts
     * Unsubscribing a podcast drops all of it together with the episodes.
     */
    static final int HISTORY_LIMIT = 50;
    static final int FAVORITES_LIMIT = 100;
    static final int TOP_PODCASTS_LIMIT = 5;

    private static final Logger log = LoggerFactory.getLogger(ListeningService.class);

    private final PodcastStore podcastStore;

    public ListeningService(PodcastStore podcastStore) {
        this.podcastStore = podcastStore;
    }

    public PlaybackTicket play(long episodeId) {
        StoredEpisode episode = requireEpisode(episodeId);
        podcastStore.recordPlay(episodeId);
        Optional<StoredPodcast> podcast = podcastStore.findPodcast(episode.podcastId());
        log.info("Play recorded: episodeId={}, podcastId={}", episodeId, episode.podcastId());
        return new PlaybackTicket(
                episode.audioUrl(),
                episode.title(),
                podcast.map(StoredPodcast::title).orElse(""),
                podcast.map(StoredPodcast::imageUrl).orElse(""));
    }

    // Negative positions are stored as 0.
    public StoredEpisode updateProgress(long episodeId, int progressSeconds) {
        requireEpisode(episodeId);
        return podcastStore.updateProgress(episodeId, Math.max(progressSeconds, 0));
    }

    public List<HistoryItem> history() {
        return podcastStore.listPlayHistory().stream()
                .limit(HISTORY_LIMIT)
                .map(this::toHistoryItem)
                .toList();
    }

    public ListeningStats stats() {
        List<PlayRecord> plays = podcastStore.listPlayHistory();
        long totalDuration = plays.stream().mapToLong(PlayRecord::durationSeconds).sum();

        Map<Long, Long> playsByPodcast = new LinkedHashMap<>();
        for (PlayRecord play : plays) {
            playsByPodcast.merge(play.podcastId(), 1L, Long::sum);
        }
        List<ListeningStats.PodcastPlays> topPodcasts = playsByPodcast.entrySet().stream()
                .sorted(Map.Entry.<Long, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<Long, Long>comparingByKey()))
                .flatMap(entry -> podcastStore.findPodcast(entry.getKey())
                        .map(podcast -> new ListeningStats.PodcastPlays(podcast.id(), podcast.title(), entry.getValue()))
                        .stream())
                .limit(TOP_PODCASTS_LIMIT)
                .toList();

        return new ListeningStats(plays.size(), totalDuration, formatTotal(totalDuration), topPodcasts);
    }

    public List<StoredPodcast> favorites() {
        return podcastStore.listFavorites().stream()
                .limit(FAVORITES_LIMIT)
                .toList();
    }

    /** @return false when the podcast was already a favorite */
    public boolean addFavorite(long podcastId) {
        if (podcastStore.findPodcast(podcastId).isEmpty()) {
            throw new PodcastNotFoundException(podcastId);
        }
        return podcastStore.addFavorite(podcastId);
    }

    /** @return false when the podcast was not a favorite */
    public boolean removeFavorite(long podcastId) {
        return podcastStore.removeFavorite(podcastId);
    }

    // "2h 5m" from one hour up, "42m" below.
    static String formatTotal(long totalSeconds) {
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        return hours > 0 ? hours + "h " + minutes + "m" : minutes + "m";
    }

    private HistoryItem toHistoryItem(PlayRecord play) {
        return new HistoryItem(
                play.id(),
                play.episodeId(),
                play.podcastId(),
                podcastStore.findEpisode(play.episodeId()).map(StoredEpisode::title).orElse(""),
                podcastStore.findPodcast(play.podcastId()).map(StoredPodcast::title).orElse(""),
                play.playedAt());
    }

    private StoredEpisode requireEpisode(long episodeId) {
        return podcastStore.findEpisode(episodeId)
                .orElseThrow(() -> new EpisodeNotFoundException(episodeId));
    }
}
