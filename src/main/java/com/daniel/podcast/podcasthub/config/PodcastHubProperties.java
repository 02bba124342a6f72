package com.daniel.podcast.podcasthub.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
// Binds external config values (e.g., from application.properties) to fields in this class

@ConfigurationProperties(prefix = "podcasthub")
public class PodcastHubProperties {

    private static final String DEFAULT_MOBILE_USER_AGENT = "Mozilla/5.0 (iPhone; CPU iPhone OS 14_0 like Mac OS X)";
    private static final String DEFAULT_DESKTOP_USER_AGENT = "Mozilla/5.0";
    private static final Duration DEFAULT_PAGE_TIMEOUT = Duration.ofSeconds(15);
    private static final Duration DEFAULT_FEED_TIMEOUT = Duration.ofSeconds(15);
    private static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofSeconds(10);

    private String mobileUserAgent = DEFAULT_MOBILE_USER_AGENT;
    private String desktopUserAgent = DEFAULT_DESKTOP_USER_AGENT;
    private Duration pageTimeout = DEFAULT_PAGE_TIMEOUT;
    private Duration feedTimeout = DEFAULT_FEED_TIMEOUT;
    private Duration lookupTimeout = DEFAULT_LOOKUP_TIMEOUT;
    private String xiaoyuzhouFeedPrefix = "https://feed.xiaoyuzhoufm.com/podcast/";
    private String xiaoyuzhouImagePrefix = "https://image.xyzcdn.net/common/";
    private String neteaseFeedPrefix = "https://podcastrx.netlify.app/feed/netease/";
    private String appleLookupUrl = "https://itunes.apple.com/lookup";
    private String audioCdnHost = "media.xyzcdn.net";
    private List<String> extraFeedHosts = new ArrayList<>();

    public String getMobileUserAgent() {
        return mobileUserAgent;
    }

    public void setMobileUserAgent(String mobileUserAgent) {
        this.mobileUserAgent = mobileUserAgent;
    }

    public String getDesktopUserAgent() {
        return desktopUserAgent;
    }

    public void setDesktopUserAgent(String desktopUserAgent) {
        this.desktopUserAgent = desktopUserAgent;
    }

    public Duration getPageTimeout() {
        return pageTimeout;
    }

    public void setPageTimeout(Duration pageTimeout) {
        this.pageTimeout = pageTimeout;
    }

    public Duration getFeedTimeout() {
        return feedTimeout;
    }

    public void setFeedTimeout(Duration feedTimeout) {
        this.feedTimeout = feedTimeout;
    }

    public Duration getLookupTimeout() {
        return lookupTimeout;
    }

    public void setLookupTimeout(Duration lookupTimeout) {
        this.lookupTimeout = lookupTimeout;
    }

    public String getXiaoyuzhouFeedPrefix() {
        return xiaoyuzhouFeedPrefix;
    }

    public void setXiaoyuzhouFeedPrefix(String xiaoyuzhouFeedPrefix) {
        this.xiaoyuzhouFeedPrefix = xiaoyuzhouFeedPrefix;
    }

    public String getXiaoyuzhouImagePrefix() {
        return xiaoyuzhouImagePrefix;
    }

    public void setXiaoyuzhouImagePrefix(String xiaoyuzhouImagePrefix) {
        this.xiaoyuzhouImagePrefix = xiaoyuzhouImagePrefix;
    }

    public String getNeteaseFeedPrefix() {
        return neteaseFeedPrefix;
    }

    public void setNeteaseFeedPrefix(String neteaseFeedPrefix) {
        this.neteaseFeedPrefix = neteaseFeedPrefix;
    }

    public String getAppleLookupUrl() {
        return appleLookupUrl;
    }

    public void setAppleLookupUrl(String appleLookupUrl) {
        this.appleLookupUrl = appleLookupUrl;
    }

    public String getAudioCdnHost() {
        return audioCdnHost;
    }

    public void setAudioCdnHost(String audioCdnHost) {
        this.audioCdnHost = audioCdnHost;
    }

    public List<String> getExtraFeedHosts() {
        return extraFeedHosts;
    }

    public void setExtraFeedHosts(List<String> extraFeedHosts) {
        this.extraFeedHosts = extraFeedHosts;
    }

    // Share pages only render the full episode payload for mobile browsers.
    public String effectiveMobileUserAgent() {
        if (mobileUserAgent == null || mobileUserAgent.trim().isEmpty()) {
            return DEFAULT_MOBILE_USER_AGENT;
        }
        return mobileUserAgent.trim();
    }

    public String effectiveDesktopUserAgent() {
        if (desktopUserAgent == null || desktopUserAgent.trim().isEmpty()) {
            return DEFAULT_DESKTOP_USER_AGENT;
        }
        return desktopUserAgent.trim();
    }

    public Duration effectivePageTimeout() {
        return positiveOrDefault(pageTimeout, DEFAULT_PAGE_TIMEOUT);
    }

    public Duration effectiveFeedTimeout() {
        return positiveOrDefault(feedTimeout, DEFAULT_FEED_TIMEOUT);
    }

    public Duration effectiveLookupTimeout() {
        return positiveOrDefault(lookupTimeout, DEFAULT_LOOKUP_TIMEOUT);
    }

    // Prefixes are joined with an id, so they always end with exactly one slash.
    public String normalizedXiaoyuzhouFeedPrefix() {
        return withTrailingSlash(xiaoyuzhouFeedPrefix);
    }

    public String normalizedXiaoyuzhouImagePrefix() {
        return withTrailingSlash(xiaoyuzhouImagePrefix);
    }

    public String normalizedNeteaseFeedPrefix() {
        return withTrailingSlash(neteaseFeedPrefix);
    }

    // Query string is appended by the caller, so strip any trailing '?' or '/'.
    public String normalizedAppleLookupUrl() {
        if (appleLookupUrl == null) {
            return "";
        }
        String trimmed = appleLookupUrl.trim();
        while (trimmed.endsWith("/") || trimmed.endsWith("?")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String effectiveAudioCdnHost() {
        if (audioCdnHost == null || audioCdnHost.trim().isEmpty()) {
            return "media.xyzcdn.net";
        }
        return audioCdnHost.trim();
    }

    // Blank entries would match every URL in the detector, so they are dropped here.
    public List<String> normalizedExtraFeedHosts() {
        if (extraFeedHosts == null) {
            return List.of();
        }
        return extraFeedHosts.stream()
                .filter(host -> host != null && !host.trim().isEmpty())
                .map(String::trim)
                .toList();
    }

    private Duration positiveOrDefault(Duration value, Duration fallback) {
        if (value == null || value.isZero() || value.isNegative()) {
            return fallback;
        }
        return value;
    }

    private String withTrailingSlash(String value) {
        if (value == null || value.trim().isEmpty()) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + "/";
    }
}
