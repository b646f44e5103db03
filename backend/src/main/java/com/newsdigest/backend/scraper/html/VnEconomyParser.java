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
public class VnEconomyParser extends BaseHtmlListingParser {

    public static final String TYPE = "vneconomy";

    private static final Pattern ARTICLE_URL = Pattern.compile("-e\\d+\\.htm$");

    public VnEconomyParser(PageFetcher pageFetcher, TimestampNormalizer timestampNormalizer,
                           ScrapingConfig scrapingConfig, @Qualifier("articleFetchExecutor") Executor articleFetchExecutor) {
        super(pageFetcher, timestampNormalizer, scrapingConfig, articleFetchExecutor);
    }

    @Override
    public String getSourceType() {
        return TYPE;
    }

    @Override
    protected String getListingRegionSelector() {
        return "div.featured-row, section.zone--timeline";
    }

    @Override
    protected Pattern getArticleUrlPattern() {
        return ARTICLE_URL;
    }

    @Override
    protected List<String> getTitleSelectors() {
        return List.of("h1.detail__title", "h1.name-detail", "h1");
    }

    @Override
    protected List<String> getSummarySelectors() {
        return List.of("h2.detail__summary", "div.detail__summary", ".news-sapo");
    }

    @Override
    protected List<String> getContentSelectors() {
        return List.of("div.detail__content", "div.news-content");
    }

    @Override
    protected List<String> getPublishedTimeSelectors() {
        // HH:mm dd/MM/yyyy
        return List.of("div.detail__meta", "div.date-detail");
    }

    @Override
    protected ZoneId getSiteZone() {
        return ZoneOffset.ofHours(7);
    }
}
