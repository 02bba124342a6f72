package com.daniel.podcast.podcasthub.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.daniel.podcast.podcasthub.model.PodcastInfo;

/**
 * Persistence collaborator of the engine.
 * Implementations must keep audio URLs unique per podcast and be safe to call from several threads.
 */
public interface PodcastStore {

    /** Podcasts are keyed by canonical feed URL. */
    PodcastLookup getOrCreatePodcast(PodcastInfo info);

    Optional<StoredPodcast> findPodcast(long podcastId);

    List<StoredPodcast> listPodcasts();

    void updateEpisodeCount(long podcastId, int episodeCount);

    Set<String> listAudioUrls(long podcastId);

    /** @return false when the podcast already has a row with the same audio URL */
    boolean insertEpisode(long podcastId, NewEpisode episode);

    /** Newest publish date first. */
    List<StoredEpisode> listEpisodes(long podcastId);

    /** Removes the podcast with its episodes, favorite mark and play history; false when the id is unknown. */
    boolean deletePodcast(long podcastId);

    Optional<StoredEpisode> findEpisode(long episodeId);

    /** Marks the episode played and appends a history row with progress 0. */
    PlayRecord recordPlay(long episodeId);

    StoredEpisode updateProgress(long episodeId, int progressSeconds);

    /** Most recent play first. */
    List<PlayRecord> listPlayHistory();

    /** @return false when the podcast was already a favorite */
    boolean addFavorite(long podcastId);

    /** @return false when the podcast was not a favorite */
    boolean removeFavorite(long podcastId);

    /** Most recently favorited first. */
    List<StoredPodcast> listFavorites();
}
