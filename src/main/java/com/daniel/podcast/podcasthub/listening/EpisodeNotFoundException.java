package com.daniel.podcast.podcasthub.listening;

public class EpisodeNotFoundException extends RuntimeException {

    public EpisodeNotFoundException(long episodeId) {
        super("Episode not found: " + episodeId);
    }
}
