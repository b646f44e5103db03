package com.newsdigest.backend.scraper.fetch;

import java.io.IOException;
import org.jsoup.nodes.Document;

public interface PageFetcher {

    /**
     * Fetch and parse an HTML page. The returned document carries the page URL as base URI.
     */
    Document fetchDocument(String url) throws IOException;

    /**
     * Fetch a raw response body, used for feeds so the XML parser can detect the encoding itself
     */
    byte[] fetchBytes(String url) throws IOException;
}
