package com.daniel.podcast.podcasthub.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
// HttpFetcher backed by java.net.http; bodies are always decoded as UTF-8.
public class JdkHttpFetcher implements HttpFetcher {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpFetcher.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;

    public JdkHttpFetcher() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .build());
    }

    JdkHttpFetcher(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Optional<String> get(String url, Map<String, String> headers, Duration timeout) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .GET();
            if (headers != null) {
                headers.forEach(builder::header);
            }
            request = builder.build();
        } catch (IllegalArgumentException ex) {
            // Malformed URL or restricted header name.
            log.warn("Rejected request to '{}': {}", url, ex.getMessage());
            return Optional.empty();
        }

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("GET '{}' returned HTTP {}", url, status);
                return Optional.empty();
            }
            return Optional.ofNullable(response.body());
        } catch (IOException ex) {
            log.warn("GET '{}' failed: {}", url, ex.toString());
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("GET '{}' interrupted", url);
            return Optional.empty();
        }
    }
}
