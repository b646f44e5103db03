package com.newsdigest.backend.scraper;

import org.slf4j.LoggerFactory;

/**
 * Receives per-entry and per-URL faults raised while parsing a source.
 */
@FunctionalInterface
public interface ErrorReporter {

    void report(String url, String message, Throwable cause);

    static ErrorReporter logging(String source) {
        return (url, message, cause) -> LoggerFactory.getLogger(ErrorReporter.class)
                .warn("⚠️ [{}] {} ({}): {}", source, message, url, cause != null ? cause.getMessage() : "-");
    }
}
