package com.daniel.podcast.podcasthub.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

public final class Fixtures {

    private Fixtures() {
    }

    // Reads src/test/resources/fixtures/<name> as UTF-8.
    public static String read(String name) {
        try {
            return StreamUtils.copyToString(
                    new ClassPathResource("fixtures/" + name).getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Missing fixture " + name, ex);
        }
    }
}
