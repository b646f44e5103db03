package com.newsdigest.backend.scraper.fetch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * In-memory fetcher: serves registered bodies and fails every other URL like an HTTP 404.
 */
public class StubPageFetcher implements PageFetcher {

    private final Map<String, String> bodies = new HashMap<>();
    private final List<String> requested = new ArrayList<>();

    public StubPageFetcher with(String url, String body) {
        bodies.put(url, body);
        return this;
    }

    public List<String> getRequested() {
        return requested;
    }

    @Override
    public synchronized Document fetchDocument(String url) throws IOException {
        return Jsoup.parse(body(url), url);
    }

    @Override
    public synchronized byte[] fetchBytes(String url) throws IOException {
        return body(url).getBytes(StandardCharsets.UTF_8);
    }

    private String body(String url) throws IOException {
        requested.add(url);
        String body = bodies.get(url);
        if (body == null) {
            throw new IOException("HTTP 404 for " + url);
        }
        return body;
    }
}
