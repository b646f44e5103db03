package com.newsdigest.backend.scraper.feed;

import com.newsdigest.backend.scraper.extract.HtmlText;
import com.newsdigest.backend.scraper.extract.TimestampNormalizer;
import com.newsdigest.backend.scraper.fetch.PageFetcher;
import org.springframework.stereotype.Component;

/**
 * Vietstock feeds open each description with a linked thumbnail and a line break, and sometimes
 * leak a CDATA terminator into the text.
 */
@Component
public class VietstockParser extends GenericFeedParser {

    public static final String TYPE = "vietstock";

    private static final int SUMMARY_MAX_LENGTH = 300;

    public VietstockParser(PageFetcher pageFetcher, TimestampNormalizer timestampNormalizer) {
        super(pageFetcher, timestampNormalizer);
    }

    @Override
    public String getSourceType() {
        return TYPE;
    }

    @Override
    protected String extractSummary(String descriptionHtml, String contentHtml) {
        String text = HtmlText.clean(HtmlText.stripLeadingBreakSegment(descriptionHtml));
        return HtmlText.truncate(HtmlText.stripCdataMarkers(text), SUMMARY_MAX_LENGTH);
    }
}
