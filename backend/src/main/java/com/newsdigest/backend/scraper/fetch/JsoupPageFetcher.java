package com.newsdigest.backend.scraper.fetch;

import com.newsdigest.backend.config.ScrapingConfig;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsoupPageFetcher implements PageFetcher {

    private final ScrapingConfig scrapingConfig;

    @Override
    public Document fetchDocument(String url) throws IOException {
        log.debug("Fetching page {}", url);
        return connect(url).get();
    }

    @Override
    public byte[] fetchBytes(String url) throws IOException {
        log.debug("Fetching feed {}", url);
        return connect(url)
                .ignoreContentType(true)
                .maxBodySize(0)
                .execute()
                .bodyAsBytes();
    }

    private Connection connect(String url) {
        return Jsoup.connect(url)
                .userAgent(scrapingConfig.getUserAgent())
                .headers(scrapingConfig.getDefaultHeaders())
                .timeout(scrapingConfig.getTimeoutSeconds() * 1000)
                .followRedirects(true);
    }
}
