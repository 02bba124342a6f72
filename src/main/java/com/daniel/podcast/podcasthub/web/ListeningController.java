package com.daniel.podcast.podcasthub.web;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.daniel.podcast.podcasthub.listening.HistoryItem;
import com.daniel.podcast.podcasthub.listening.ListeningService;
import com.daniel.podcast.podcasthub.listening.ListeningStats;
import com.daniel.podcast.podcasthub.listening.PlaybackTicket;
import com.daniel.podcast.podcasthub.store.StoredPodcast;

@RestController
@RequestMapping("/api")
// Plays, progress, history, stats and favorites. Unknown ids map to 404 in ApiExceptionHandler.
public class ListeningController {

    private final ListeningService listeningService;

    public ListeningController(ListeningService listeningService) {
        this.listeningService = listeningService;
    }

    @PostMapping("/play/{episodeId}")
    public ApiResponse<PlaybackTicket> play(@PathVariable long episodeId) {
        return ApiResponse.ok(listeningService.play(episodeId));
    }

    // Body is optional; a missing progress field counts as 0.
    @PostMapping("/progress/{episodeId}")
    public ApiResponse<Void> progress(@PathVariable long episodeId,
                                      @RequestBody(required = false) ProgressRequest request) {
        int progress = request == null || request.progress() == null ? 0 : request.progress();
        listeningService.updateProgress(episodeId, progress);
        return ApiResponse.ok(null);
    }

    @GetMapping("/history")
    public ApiResponse<List<HistoryItem>> history() {
        return ApiResponse.ok(listeningService.history());
    }

    @GetMapping("/stats")
    public ApiResponse<ListeningStats> stats() {
        return ApiResponse.ok(listeningService.stats());
    }

    @GetMapping("/favorite")
    public ApiResponse<List<StoredPodcast>> favorites() {
        return ApiResponse.ok(listeningService.favorites());
    }

    @PostMapping("/favorite/{podcastId}")
    public ApiResponse<Void> addFavorite(@PathVariable long podcastId) {
        String message = listeningService.addFavorite(podcastId) ? "Added to favorites" : "Already favorited";
        return ApiResponse.ok(message, null);
    }

    @DeleteMapping("/favorite/{podcastId}")
    public ResponseEntity<ApiResponse<Void>> removeFavorite(@PathVariable long podcastId) {
        if (!listeningService.removeFavorite(podcastId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("Not favorited"));
        }
        return ResponseEntity.ok(ApiResponse.ok("Removed from favorites", null));
    }

    public record ProgressRequest(Integer progress) {
    }
}
