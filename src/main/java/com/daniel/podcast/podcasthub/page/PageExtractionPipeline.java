package com.daniel.podcast.podcasthub.page;

import java.util.List;
import java.util.Optional;

// Runs strategies in order and keeps the first result that is present.
public class PageExtractionPipeline {

    private final List<PageExtractionStrategy> strategies;

    public PageExtractionPipeline(List<PageExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public PageExtraction run(PageSource page) {
        for (PageExtractionStrategy strategy : strategies) {
            Optional<PageExtraction> result = strategy.extract(page);
            if (result.isPresent()) {
                return result.get();
            }
        }
        return PageExtraction.empty();
    }
}
