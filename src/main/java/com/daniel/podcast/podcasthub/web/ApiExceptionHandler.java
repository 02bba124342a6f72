package com.daniel.podcast.podcasthub.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.daniel.podcast.podcasthub.listening.EpisodeNotFoundException;
import com.daniel.podcast.podcasthub.resolve.MalformedPlatformIdException;
import com.daniel.podcast.podcasthub.resolve.UnsupportedPlatformException;
import com.daniel.podcast.podcasthub.resolve.UpstreamFetchException;
import com.daniel.podcast.podcasthub.sync.PodcastNotFoundException;

@RestControllerAdvice
// Turns engine exceptions into {success:false, error} bodies instead of leaking stack traces.
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    // Bad links are the user's input problem.
    @ExceptionHandler({UnsupportedPlatformException.class, MalformedPlatformIdException.class})
    public ResponseEntity<ApiResponse<Void>> badLink(RuntimeException ex) {
        log.warn("Invalid input: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.failure(ex.getMessage()));
    }

    // Non-numeric path ids and unreadable JSON bodies.
    @ExceptionHandler({TypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiResponse<Void>> badRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.failure("Bad request"));
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<ApiResponse<Void>> upstream(UpstreamFetchException ex) {
        log.warn("Upstream failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.failure(ex.getMessage()));
    }

    @ExceptionHandler(PodcastNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> notFound(PodcastNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("Podcast not found"));
    }

    @ExceptionHandler(EpisodeNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> episodeNotFound(EpisodeNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("Episode not found"));
    }

    /*
     * Last resort. Spring MVC's own exceptions (unknown route, wrong method, unsupported media type)
     * carry their status and keep it; anything else is a 500 with the details only in the log.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> unexpected(Exception ex) {
        if (ex instanceof ErrorResponse) {
            ErrorResponse errorResponse = (ErrorResponse) ex;
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .headers(errorResponse.getHeaders())
                    .body(ApiResponse.failure(ex.getMessage()));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.failure("Internal server error"));
    }
}
