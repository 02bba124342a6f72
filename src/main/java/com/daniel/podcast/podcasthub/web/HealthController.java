package com.daniel.podcast.podcasthub.web;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.daniel.podcast.podcasthub.store.PodcastStore;

@RestController
public class HealthController {

    private final PodcastStore podcastStore;

    public HealthController(PodcastStore podcastStore) {
        this.podcastStore = podcastStore;
    }

    // Plain-text liveness probe; stays "OK" even when upstream platforms are down.
    @GetMapping(value = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public String health() {
        return "OK";
    }

    @GetMapping("/health/store")
    public ApiResponse<Map<String, Integer>> store() {
        return ApiResponse.ok(Map.of("podcasts", podcastStore.listPodcasts().size()));
    }
}
