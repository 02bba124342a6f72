package com.daniel.podcast.podcasthub.web;

import com.fasterxml.jackson.annotation.JsonInclude;

// Common JSON envelope for /api responses; null fields are left out.
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        String message,
        T data,
        String error
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, data, null);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data, null);
    }

    public static ApiResponse<Void> failure(String error) {
        return new ApiResponse<>(false, null, null, error);
    }
}
