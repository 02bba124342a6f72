package com.daniel.podcast.podcasthub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
// Used to start app.
@ConfigurationPropertiesScan
// Binds podcasthub.* values from application.properties into PodcastHubProperties.

public class PodcastHubApplication {

	public static void main(String[] args) {
		SpringApplication.run(PodcastHubApplication.class, args);
	}

}
