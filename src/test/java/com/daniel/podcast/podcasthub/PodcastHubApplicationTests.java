package com.daniel.podcast.podcasthub;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.daniel.podcast.podcasthub.support.Fixtures;
import com.daniel.podcast.podcasthub.support.StubHttpFetcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/* Boots the whole app with the network replaced by StubHttpFetcher.
The store is shared by every test in this class, so each test subscribes its own feed URL. */

@SpringBootTest
@AutoConfigureMockMvc
class PodcastHubApplicationTests {

	@TestConfiguration
	static class StubNetworkConfig {

		// Wins over JdkHttpFetcher for every resolver and engine.
		@Bean
		@Primary
		StubHttpFetcher stubHttpFetcher() {
			return new StubHttpFetcher();
		}
	}

	@Autowired
	private MockMvc mockMvc;

	@Autowired
	private StubHttpFetcher fetcher;

	@Autowired
	private ObjectMapper objectMapper;

	@BeforeEach
	void resetNetwork() {
		fetcher.reset();
	}

	// Verifies that Spring can bootstrap the application context without bean wiring errors.
	@Test
	void contextLoads() {
		System.out.println("[TEST] Spring application context loads successfully");
	}

	@Test
	void healthEndpointReturnsOk() throws Exception {
		System.out.println("[TEST] Checking /health returns 200 and OK body");
		mockMvc.perform(get("/health"))
				.andExpect(status().isOk())
				.andExpect(content().string("OK"));
	}

	@Test
	void storeHealthReportsPodcastCount() throws Exception {
		System.out.println("[TEST] Checking /health/store reports a podcast count");
		mockMvc.perform(get("/health/store"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.success").value(true))
				.andExpect(jsonPath("$.data.podcasts").isNumber());
	}

	// First subscribe stores the podcast, second one reports it as existing.
	@Test
	void subscribeRssFeedThenSubscribeAgain() throws Exception {
		System.out.println("[TEST] Subscribing an RSS feed twice");
		String feedUrl = "https://feeds.danlirencomedy.com/subscribe-twice.xml";
		fetcher.respond(feedUrl, Fixtures.read("rss-feed.xml"));

		mockMvc.perform(post("/api/podcast").contentType(MediaType.APPLICATION_JSON).content(body(feedUrl)))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.success").value(true))
				.andExpect(jsonPath("$.message").value("Added successfully"))
				.andExpect(jsonPath("$.data.title").value("Harbor Notes"))
				.andExpect(jsonPath("$.data.platform").value("RSS"))
				.andExpect(jsonPath("$.data.episodeCount").value(3));

		mockMvc.perform(post("/api/podcast").contentType(MediaType.APPLICATION_JSON).content(body(feedUrl)))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.message").value("Podcast already exists"));
	}

	// Episodes come back newest first with a display duration next to the raw seconds.
	@Test
	void listEpisodesOfSubscribedPodcast() throws Exception {
		System.out.println("[TEST] Listing episodes of a subscribed feed");
		String feedUrl = "https://feeds.danlirencomedy.com/list-episodes.xml";
		fetcher.respond(feedUrl, Fixtures.read("rss-feed.xml"));
		long podcastId = subscribe(feedUrl);

		mockMvc.perform(get("/api/podcast/{id}/episodes", podcastId))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.success").value(true))
				.andExpect(jsonPath("$.data", hasSize(2)))
				.andExpect(jsonPath("$.data[0].title").value("Tide Tables"))
				.andExpect(jsonPath("$.data[0].duration").value(2443))
				.andExpect(jsonPath("$.data[0].durationText").value("40:43"))
				.andExpect(jsonPath("$.data[1].durationText").value("1:23:35"));
	}

	@Test
	void refreshReportsEpisodeCount() throws Exception {
		System.out.println("[TEST] Refreshing a subscribed feed");
		String feedUrl = "https://feeds.danlirencomedy.com/refresh.xml";
		fetcher.respond(feedUrl, Fixtures.read("rss-feed.xml"));
		long podcastId = subscribe(feedUrl);

		mockMvc.perform(post("/api/podcast/{id}/refresh", podcastId))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.data.podcastId").value((int) podcastId))
				.andExpect(jsonPath("$.data.episodeCount").value(3));
	}

	@Test
	void listPodcastsIncludesSubscription() throws Exception {
		System.out.println("[TEST] Listing subscriptions");
		String feedUrl = "https://feeds.danlirencomedy.com/listed.xml";
		fetcher.respond(feedUrl, Fixtures.read("rss-feed.xml"));
		subscribe(feedUrl);

		mockMvc.perform(get("/api/podcast"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.success").value(true))
				.andExpect(content().string(containsString(feedUrl)));
	}

	@Test
	void missingUrlIsBadRequest() throws Exception {
		System.out.println("[TEST] Checking POST without url returns 400");
		mockMvc.perform(post("/api/podcast").contentType(MediaType.APPLICATION_JSON).content("{}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.success").value(false))
				.andExpect(jsonPath("$.error").value("Missing url parameter"));
	}

	@Test
	void unsupportedLinkIsBadRequest() throws Exception {
		System.out.println("[TEST] Checking unsupported link returns 400");
		mockMvc.perform(post("/api/podcast").contentType(MediaType.APPLICATION_JSON).content(body("https://example.com/show")))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.error").value(containsString("Unsupported platform")));
	}

	@Test
	void malformedNetEaseLinkIsBadRequest() throws Exception {
		mockMvc.perform(post("/api/podcast").contentType(MediaType.APPLICATION_JSON).content(body("https://music.163.com/#/discover")))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.success").value(false));
	}

	// No canned lookup body means the Apple lookup fails upstream.
	@Test
	void failedAppleLookupIsBadGateway() throws Exception {
		System.out.println("[TEST] Checking failed Apple lookup returns 502");
		mockMvc.perform(post("/api/podcast").contentType(MediaType.APPLICATION_JSON)
						.content(body("https://podcasts.apple.com/us/podcast/x/id555")))
				.andExpect(status().isBadGateway())
				.andExpect(jsonPath("$.success").value(false));
	}

	@Test
	void unknownPodcastIsNotFound() throws Exception {
		mockMvc.perform(get("/api/podcast/{id}/episodes", 987654))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.error").value("Podcast not found"));
		mockMvc.perform(post("/api/podcast/{id}/refresh", 987654))
				.andExpect(status().isNotFound());
	}

	@Test
	void unsubscribeRemovesPodcastAndEpisodes() throws Exception {
		System.out.println("[TEST] DELETE /api/podcast/{id} unsubscribes and the id is gone afterwards");
		String feedUrl = "https://feeds.danlirencomedy.com/unsubscribe.xml";
		fetcher.respond(feedUrl, Fixtures.read("rss-feed.xml"));
		long podcastId = subscribe(feedUrl);

		mockMvc.perform(delete("/api/podcast/{id}", podcastId))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.success").value(true))
				.andExpect(jsonPath("$.message").value("Unsubscribed"));

		mockMvc.perform(get("/api/podcast/{id}/episodes", podcastId))
				.andExpect(status().isNotFound());
		mockMvc.perform(get("/api/podcast"))
				.andExpect(jsonPath("$.data[*].id", not(hasItem((int) podcastId))));
		mockMvc.perform(delete("/api/podcast/{id}", podcastId))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.error").value("Podcast not found"));
	}

	@Test
	void playRecordsHistoryAndStats() throws Exception {
		System.out.println("[TEST] POST /api/play marks the episode played and shows up in history and stats");
		String feedUrl = "https://feeds.danlirencomedy.com/play.xml";
		fetcher.respond(feedUrl, Fixtures.read("rss-feed.xml"));
		long podcastId = subscribe(feedUrl);
		long episodeId = firstEpisodeId(podcastId);

		mockMvc.perform(post("/api/play/{id}", episodeId))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.data.title").value("Tide Tables"))
				.andExpect(jsonPath("$.data.podcastTitle").value("Harbor Notes"))
				.andExpect(jsonPath("$.data.audioUrl").value("https://cdn.example.com/harbor/tides.mp3"));

		mockMvc.perform(post("/api/progress/{id}", episodeId).contentType(MediaType.APPLICATION_JSON).content("{\"progress\":125}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.success").value(true));

		mockMvc.perform(get("/api/podcast/{id}/episodes", podcastId))
				.andExpect(jsonPath("$.data[0].played").value(true))
				.andExpect(jsonPath("$.data[0].progress").value(125));
		mockMvc.perform(get("/api/history"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.data[0].episodeId").value((int) episodeId))
				.andExpect(jsonPath("$.data[0].podcastTitle").value("Harbor Notes"));
		mockMvc.perform(get("/api/stats"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.data.totalPlays", greaterThanOrEqualTo(1)))
				.andExpect(jsonPath("$.data.totalDuration", greaterThanOrEqualTo(2443)));
	}

	@Test
	void unknownEpisodeIsNotFound() throws Exception {
		mockMvc.perform(post("/api/play/{id}", 987654))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.error").value("Episode not found"));
		mockMvc.perform(post("/api/progress/{id}", 987654))
				.andExpect(status().isNotFound());
	}

	@Test
	void favoritesCanBeAddedListedAndRemoved() throws Exception {
		System.out.println("[TEST] Favorites round trip through /api/favorite");
		String feedUrl = "https://feeds.danlirencomedy.com/favorite.xml";
		fetcher.respond(feedUrl, Fixtures.read("rss-feed.xml"));
		long podcastId = subscribe(feedUrl);

		mockMvc.perform(post("/api/favorite/{id}", podcastId))
				.andExpect(jsonPath("$.message").value("Added to favorites"));
		mockMvc.perform(post("/api/favorite/{id}", podcastId))
				.andExpect(jsonPath("$.message").value("Already favorited"));
		mockMvc.perform(get("/api/favorite"))
				.andExpect(jsonPath("$.data[*].id", hasItem((int) podcastId)));

		mockMvc.perform(delete("/api/favorite/{id}", podcastId))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.message").value("Removed from favorites"));
		mockMvc.perform(delete("/api/favorite/{id}", podcastId))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.error").value("Not favorited"));
		mockMvc.perform(post("/api/favorite/{id}", 987654))
				.andExpect(status().isNotFound());
	}

	// Spring's own 4xx responses are not swallowed by the catch-all handler.
	@Test
	void nonNumericIdIsBadRequest() throws Exception {
		mockMvc.perform(get("/api/podcast/{id}/episodes", "abc"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.success").value(false));
	}

	private long firstEpisodeId(long podcastId) throws Exception {
		String response = mockMvc.perform(get("/api/podcast/{id}/episodes", podcastId))
				.andReturn()
				.getResponse()
				.getContentAsString();
		return objectMapper.readTree(response).path("data").path(0).path("id").asLong();
	}

	private long subscribe(String feedUrl) throws Exception {
		String response = mockMvc.perform(post("/api/podcast").contentType(MediaType.APPLICATION_JSON).content(body(feedUrl)))
				.andExpect(status().isOk())
				.andReturn()
				.getResponse()
				.getContentAsString();
		JsonNode json = objectMapper.readTree(response);
		return json.path("data").path("id").asLong();
	}

	private String body(String url) throws Exception {
		return objectMapper.writeValueAsString(Map.of("url", url));
	}
}
