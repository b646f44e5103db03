package com.newsdigest.backend.scraper.feed;

import com.newsdigest.backend.scraper.extract.HtmlText;
import com.newsdigest.backend.scraper.extract.TimestampNormalizer;
import com.newsdigest.backend.scraper.fetch.PageFetcher;
import org.springframework.stereotype.Component;

/**
 * Market Times puts the article body in {@code content:encoded} and often leaves the description
 * empty.
 */
@Component
public class MarketTimesParser extends GenericFeedParser {

    public static final String TYPE = "markettimes";

    public MarketTimesParser(PageFetcher pageFetcher, TimestampNormalizer timestampNormalizer) {
        super(pageFetcher, timestampNormalizer);
    }

    @Override
    public String getSourceType() {
        return TYPE;
    }

    @Override
    protected String extractSummary(String descriptionHtml, String contentHtml) {
        String summary = HtmlText.clean(descriptionHtml);
        return summary.isEmpty() ? HtmlText.clean(contentHtml) : summary;
    }
}
