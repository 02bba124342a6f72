package com.daniel.podcast.podcasthub.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    // Injected so sync code can fall back to "now" and tests can pin it.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
