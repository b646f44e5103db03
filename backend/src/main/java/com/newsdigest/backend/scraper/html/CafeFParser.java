package com.newsdigest.backend.scraper.html;

import com.newsdigest.backend.config.ScrapingConfig;
import com.newsdigest.backend.scraper.extract.TimestampNormalizer;
import com.newsdigest.backend.scraper.fetch.PageFetcher;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class CafeFParser extends BaseHtmlListingParser {

    public static final String TYPE = "cafef";

    // Article URLs end in a long numeric id: /ten-bai-viet-188240501083012345.chn
    private static final Pattern ARTICLE_URL = Pattern.compile("-\\d{15,}\\.chn$");

    public CafeFParser(PageFetcher pageFetcher, TimestampNormalizer timestampNormalizer,
                       ScrapingConfig scrapingConfig, @Qualifier("articleFetchExecutor") Executor articleFetchExecutor) {
        super(pageFetcher, timestampNormalizer, scrapingConfig, articleFetchExecutor);
    }

    @Override
    public String getSourceType() {
        return TYPE;
    }

    @Override
    protected String getListingRegionSelector() {
        return "div.list-main, div.tlitem-flex";
    }

    @Override
    protected Pattern getArticleUrlPattern() {
        return ARTICLE_URL;
    }

    @Override
    protected List<String> getTitleSelectors() {
        return List.of("h1.title", "h1");
    }

    @Override
    protected List<String> getSummarySelectors() {
        return List.of("h2.sapo", "p.sapo", ".sapo");
    }

    @Override
    protected List<String> getContentSelectors() {
        return List.of("div.detail-content", "div.contentdetail");
    }

    @Override
    protected List<String> getPublishedTimeSelectors() {
        // dd-MM-yyyy - HH:mm
        return List.of("span.pdate", "[data-role=publishdate]");
    }

    @Override
    protected ZoneId getSiteZone() {
        return ZoneOffset.ofHours(7);
    }
}
