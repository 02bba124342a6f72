package com.daniel.podcast.podcasthub.feed;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.daniel.podcast.podcasthub.config.PodcastHubProperties;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndImage;

@Component
// Resolves a generic feed's cover image by walking an ordered list of sources until one yields a URL.
public class FeedCoverResolver {

    private static final Pattern ITUNES_IMAGE = Pattern.compile(
            "<itunes:image[^>]*href=\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHANNEL_IMAGE_URL = Pattern.compile(
            "<image[^>]*>\\s*<url>([^<]+)</url>", Pattern.CASE_INSENSITIVE);
    private static final Pattern MIRROR_PODCAST_ID = Pattern.compile("/podcast/([a-zA-Z0-9]+)");
    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".webp");
    private static final String DEFAULT_IMAGE_EXTENSION = ".png";
    private static final String XIAOYUZHOU_MIRROR_MARKER = "xyzfm";

    @FunctionalInterface
    private interface CoverSource {
        Optional<String> find(String sourceUrl, FetchedFeed fetched);
    }

    private final PodcastHubProperties properties;
    private final List<CoverSource> sources;

    public FeedCoverResolver(PodcastHubProperties properties) {
        this.properties = properties;
        this.sources = List.of(
                this::fromFeedImage,
                this::fromItunesImageMarkup,
                this::fromChannelImageMarkup,
                this::fromMirrorPodcastId);
    }

    /*
     * Returns "" when no source produced an image; the podcast is still stored without a cover.
     * fetched may be null when the feed could not be downloaded, in which case only the
     * URL-derived heuristic can still produce something.
     */
    public String resolve(String sourceUrl, FetchedFeed fetched) {
        for (CoverSource source : sources) {
            Optional<String> image = source.find(sourceUrl, fetched);
            if (image.isPresent()) {
                return image.get();
            }
        }
        return "";
    }

    private Optional<String> fromFeedImage(String sourceUrl, FetchedFeed fetched) {
        if (fetched == null || fetched.feed() == null) {
            return Optional.empty();
        }
        SyndFeed feed = fetched.feed();
        SyndImage image = feed.getImage();
        if (image != null && StringUtils.hasText(image.getUrl())) {
            return Optional.of(image.getUrl().trim());
        }
        // Atom feeds expose <logo>/<icon> instead of an RSS <image>.
        SyndImage icon = feed.getIcon();
        if (icon != null && StringUtils.hasText(icon.getUrl())) {
            return Optional.of(icon.getUrl().trim());
        }
        return Optional.empty();
    }

    // Some hosts serve extensionless artwork URLs that clients refuse to render.
    private Optional<String> fromItunesImageMarkup(String sourceUrl, FetchedFeed fetched) {
        return scan(ITUNES_IMAGE, fetched).map(url -> hasImageExtension(url) ? url : url + DEFAULT_IMAGE_EXTENSION);
    }

    private Optional<String> fromChannelImageMarkup(String sourceUrl, FetchedFeed fetched) {
        return scan(CHANNEL_IMAGE_URL, fetched);
    }

    // Only Xiaoyuzhou feed mirrors follow the image.xyzcdn.net/common/<2 chars>/<id>.jpg layout.
    private Optional<String> fromMirrorPodcastId(String sourceUrl, FetchedFeed fetched) {
        if (sourceUrl == null || !sourceUrl.contains(XIAOYUZHOU_MIRROR_MARKER)) {
            return Optional.empty();
        }
        Matcher matcher = MIRROR_PODCAST_ID.matcher(sourceUrl);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String podcastId = matcher.group(1);
        String shard = podcastId.substring(0, Math.min(2, podcastId.length()));
        return Optional.of(properties.normalizedXiaoyuzhouImagePrefix() + shard + "/" + podcastId + ".jpg");
    }

    private Optional<String> scan(Pattern pattern, FetchedFeed fetched) {
        if (fetched == null || fetched.rawXml() == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(fetched.rawXml());
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private boolean hasImageExtension(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }
}
