package com.newsdigest.backend.scraper.extract;

import java.util.Optional;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

/**
 * Jsoup based helpers for turning feed and page markup into plain text.
 */
public final class HtmlText {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern LEADING_BREAK_SEGMENT = Pattern.compile("(?is)^.*?<\\s*/?\\s*br\\s*/?\\s*>");
    private static final Pattern LEADING_BYLINE = Pattern.compile("^\\s*\\([^)]{1,40}\\)\\s*[-–—:]?\\s*");
    private static final Pattern CDATA_MARKERS = Pattern.compile("<!\\[CDATA\\[|]]>");

    private HtmlText() {
    }

    /**
     * Strip markup, decode entities and collapse whitespace. Null input gives an empty string.
     */
    public static String clean(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return collapseWhitespace(Jsoup.parse(html).text());
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * First {@code <img src>} in a markup fragment
     */
    public static Optional<String> firstImage(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Element img = Jsoup.parse(html).selectFirst("img[src]");
        return img == null ? Optional.empty() : nonBlank(img.attr("src"));
    }

    /**
     * Drop everything up to and including the first line break, when there is one.
     */
    public static String stripLeadingBreakSegment(String html) {
        if (html == null) {
            return "";
        }
        return LEADING_BREAK_SEGMENT.matcher(html).replaceFirst("");
    }

    /**
     * Drop a parenthesised agency marker such as {@code (ĐTCK) - } at the start of a summary
     */
    public static String stripLeadingByline(String text) {
        if (text == null) {
            return "";
        }
        return LEADING_BYLINE.matcher(text).replaceFirst("");
    }

    public static String stripCdataMarkers(String text) {
        if (text == null) {
            return "";
        }
        return CDATA_MARKERS.matcher(text).replaceAll("").trim();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int end = maxLength > 0 && Character.isHighSurrogate(text.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
        return text.substring(0, end).trim() + "...";
    }

    public static Optional<String> nonBlank(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
