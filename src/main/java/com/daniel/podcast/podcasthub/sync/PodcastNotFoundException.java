package com.daniel.podcast.podcasthub.sync;

public class PodcastNotFoundException extends RuntimeException {

    public PodcastNotFoundException(long podcastId) {
        super("Podcast not found: " + podcastId);
    }
}
