package com.newsdigest.backend.config;

import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "scraping")
@Data
public class ScrapingConfig {

    private String userAgent = "Mozilla/5.0 (compatible; NewsDigestBot/0.1; news aggregation)";
    private int timeoutSeconds = 20;

    // Listing pages
    private int maxArticlesPerListing = 30;
    private int maxConcurrentArticleFetches = 4;

    private int maxConcurrentSources = 6;

    // Default headers for HTTP requests
    private Map<String, String> defaultHeaders = Map.of(
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "vi-VN,vi;q=0.9,en-US;q=0.8,en;q=0.7"
    );

    // Listing links to ignore
    private List<String> excludedUrlPatterns = List.of(
            "javascript:", "mailto:", "/video", "/podcast", "/multimedia", "/tag/", "/search"
    );
}
