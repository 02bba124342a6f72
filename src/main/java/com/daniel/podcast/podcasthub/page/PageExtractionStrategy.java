package com.daniel.podcast.podcasthub.page;

import java.util.Optional;

/**
 * One independent way of reading a show page.
 * An empty result means "not applicable to this page", and the pipeline moves on to the next strategy.
 */
@FunctionalInterface
public interface PageExtractionStrategy {

    Optional<PageExtraction> extract(PageSource page);
}
