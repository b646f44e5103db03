package com.newsdigest.backend.scraper;

import com.newsdigest.backend.scraper.feed.GenericFeedParser;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dispatch table from source type tag to parser. Unknown tags fall back to the generic feed parser.
 */
@Slf4j
@Component
public class ParserRegistry {

    public static final String DEFAULT_TYPE = GenericFeedParser.TYPE;

    private final Map<String, NewsParser> parsers = new LinkedHashMap<>();

    public ParserRegistry(List<NewsParser> parsers) {
        parsers.forEach(this::register);
        if (!this.parsers.containsKey(DEFAULT_TYPE)) {
            throw new IllegalStateException("No parser registered for default type '" + DEFAULT_TYPE + "'");
        }
    }

    public void register(NewsParser parser) {
        String type = normalize(parser.getSourceType());
        NewsParser previous = parsers.put(type, parser);
        if (previous != null) {
            log.warn("Parser {} replaced {} for type '{}'", parser.getClass().getSimpleName(),
                    previous.getClass().getSimpleName(), type);
        } else {
            log.info("Registered parser {} for type '{}'", parser.getClass().getSimpleName(), type);
        }
    }

    public NewsParser getParser(String sourceType) {
        String type = sourceType == null || sourceType.isBlank() ? DEFAULT_TYPE : normalize(sourceType);
        NewsParser parser = parsers.get(type);
        if (parser == null) {
            log.warn("Unknown source type '{}', falling back to '{}'", sourceType, DEFAULT_TYPE);
            return parsers.get(DEFAULT_TYPE);
        }
        return parser;
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(parsers.keySet());
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
