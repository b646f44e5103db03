package com.newsdigest.backend.model.dto;

import com.newsdigest.backend.scraper.ErrorReporter;
import lombok.Value;

@Value
public class FeedContext {
    String source;
    String sourceType;
    ErrorReporter errorReporter;

    public static FeedContext of(String source, String sourceType) {
        return new FeedContext(source, sourceType, ErrorReporter.logging(source));
    }

    public void report(String url, String message, Throwable cause) {
        errorReporter.report(url, message, cause);
    }
}
