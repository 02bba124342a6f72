package com.daniel.podcast.podcasthub.resolve;

import com.daniel.podcast.podcasthub.model.PlatformTag;
import com.daniel.podcast.podcasthub.model.PodcastInfo;

/**
 * Turns a share link of one platform into podcast metadata.
 * Exactly one bean exists per {@link PlatformTag} except {@link PlatformTag#UNKNOWN}.
 */
public interface PodcastResolver {

    PlatformTag platform();

    PodcastInfo resolve(String url);
}
