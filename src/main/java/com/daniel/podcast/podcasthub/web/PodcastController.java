package com.daniel.podcast.podcasthub.web;

import java.time.Instant;
import java.util.List;

import org.springframework.http.ResponseEntity; // Wraps HTTP status/headers/body in controller responses.
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.daniel.podcast.podcasthub.media.DurationNormalizer;
import com.daniel.podcast.podcasthub.store.StoredEpisode;
import com.daniel.podcast.podcasthub.store.StoredPodcast;
import com.daniel.podcast.podcasthub.sync.PodcastSubscriptionService;
import com.daniel.podcast.podcasthub.sync.SubscriptionResult;

@RestController
@RequestMapping("/api/podcast")
// Thin HTTP adapter over PodcastSubscriptionService; failures are mapped in ApiExceptionHandler.
public class PodcastController {

    private static final int MAX_TITLE_LENGTH = 200;

    private final PodcastSubscriptionService subscriptionService;

    public PodcastController(PodcastSubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @GetMapping
    public ApiResponse<List<StoredPodcast>> podcasts() {
        return ApiResponse.ok(subscriptionService.podcasts());
    }

    @PostMapping
    public ResponseEntity<ApiResponse<?>> subscribe(@RequestBody(required = false) SubscribeRequest request) {
        if (request == null || !StringUtils.hasText(request.url())) {
            return ResponseEntity.badRequest().body(ApiResponse.failure("Missing url parameter"));
        }

        SubscriptionResult result = subscriptionService.subscribe(request.url().trim());
        String message = result.alreadySubscribed() ? "Podcast already exists" : "Added successfully";
        return ResponseEntity.ok(ApiResponse.ok(message, result.podcast()));
    }

    @DeleteMapping("/{podcastId}")
    public ApiResponse<Void> unsubscribe(@PathVariable long podcastId) {
        subscriptionService.unsubscribe(podcastId);
        return ApiResponse.ok("Unsubscribed", null);
    }

    @PostMapping("/{podcastId}/refresh")
    public ApiResponse<RefreshView> refresh(@PathVariable long podcastId) {
        StoredPodcast podcast = subscriptionService.refresh(podcastId);
        return ApiResponse.ok("Refreshed", new RefreshView(podcast.id(), podcast.episodeCount()));
    }

    @GetMapping("/{podcastId}/episodes")
    public ApiResponse<List<EpisodeView>> episodes(@PathVariable long podcastId) {
        List<EpisodeView> episodes = subscriptionService.episodes(podcastId).stream()
                .map(this::toEpisodeView)
                .toList();
        return ApiResponse.ok(episodes);
    }

    private EpisodeView toEpisodeView(StoredEpisode episode) {
        String title = episode.title().length() > MAX_TITLE_LENGTH
                ? episode.title().substring(0, MAX_TITLE_LENGTH)
                : episode.title();
        return new EpisodeView(
                episode.id(),
                episode.podcastId(),
                title,
                episode.audioUrl(),
                episode.durationSeconds(),
                DurationNormalizer.format(episode.durationSeconds()),
                episode.pubDate(),
                episode.played(),
                episode.progressSeconds());
    }

    public record SubscribeRequest(String url) {
    }

    public record RefreshView(long podcastId, int episodeCount) {
    }

    public record EpisodeView(
            long id,
            long podcastId,
            String title,
            String audioUrl,
            int duration,
            String durationText,
            Instant pubDate,
            boolean played,
            int progress) {
    }
}
