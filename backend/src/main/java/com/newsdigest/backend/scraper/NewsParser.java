package com.newsdigest.backend.scraper;

import com.newsdigest.backend.model.dto.FeedContext;
import com.newsdigest.backend.model.dto.RawItem;
import java.util.stream.Stream;

/**
 * Extraction strategy for one kind of source. Implementations never throw for a bad entry or an
 * unreachable URL; faults go to the context's error reporter and the entry is left out.
 */
public interface NewsParser {

    /**
     * Tag used in the source configuration to select this parser
     */
    String getSourceType();

    Stream<RawItem> parse(String url, FeedContext context);
}
