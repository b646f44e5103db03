package com.newsdigest.backend.scraper.html;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.newsdigest.backend.config.ScrapingConfig;
import com.newsdigest.backend.model.dto.FeedContext;
import com.newsdigest.backend.model.dto.RawItem;
import com.newsdigest.backend.scraper.NewsParser;
import com.newsdigest.backend.scraper.extract.DateCandidate;
import com.newsdigest.backend.scraper.extract.HtmlText;
import com.newsdigest.backend.scraper.extract.TimestampNormalizer;
import com.newsdigest.backend.scraper.fetch.PageFetcher;
import java.io.IOException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Sites without a usable feed: article links are discovered on a listing page, then each article
 * page is fetched and read. Subclasses supply the site's selectors and URL shape.
 */
@Slf4j
public abstract class BaseHtmlListingParser implements NewsParser {

    private static final int SUMMARY_MAX_LENGTH = 300;

    protected final PageFetcher pageFetcher;
    protected final TimestampNormalizer timestampNormalizer;
    protected final ScrapingConfig scrapingConfig;
    private final Executor articleFetchExecutor;

    protected BaseHtmlListingParser(PageFetcher pageFetcher, TimestampNormalizer timestampNormalizer,
                                    ScrapingConfig scrapingConfig, Executor articleFetchExecutor) {
        this.pageFetcher = pageFetcher;
        this.timestampNormalizer = timestampNormalizer;
        this.scrapingConfig = scrapingConfig;
        this.articleFetchExecutor = articleFetchExecutor;
    }

    /**
     * Region of the listing page that holds the latest articles
     */
    protected abstract String getListingRegionSelector();

    protected abstract Pattern getArticleUrlPattern();

    protected abstract List<String> getTitleSelectors();

    protected abstract List<String> getSummarySelectors();

    protected abstract List<String> getContentSelectors();

    /**
     * Elements holding the visible publication time, read in the site zone
     */
    protected abstract List<String> getPublishedTimeSelectors();

    protected abstract ZoneId getSiteZone();

    protected String getArticleLinkSelector() {
        return "a[href]";
    }

    @Override
    public Stream<RawItem> parse(String url, FeedContext context) {
        Document listing;
        try {
            listing = pageFetcher.fetchDocument(url);
        } catch (IOException e) {
            context.report(url, "Failed to fetch listing page", e);
            return Stream.empty();
        }

        List<String> articleUrls = discoverArticleUrls(listing);
        log.info("🔗 Found {} article URLs on {}", articleUrls.size(), url);

        List<CompletableFuture<Optional<RawItem>>> futures = articleUrls.stream()
                .map(articleUrl -> CompletableFuture.supplyAsync(
                        () -> fetchArticle(articleUrl, context), articleFetchExecutor))
                .toList();

        return futures.stream()
                .map(CompletableFuture::join)
                .flatMap(Optional::stream);
    }

    /**
     * Absolute article URLs inside the listing region, de-duplicated in page order and capped
     */
    protected List<String> discoverArticleUrls(Document listing) {
        Set<String> urls = new LinkedHashSet<>();
        int max = scrapingConfig.getMaxArticlesPerListing();

        for (Element link : listing.select(getListingRegionSelector()).select(getArticleLinkSelector())) {
            String url = stripFragment(link.absUrl("href"));
            if (url.isEmpty() || isExcluded(url) || !getArticleUrlPattern().matcher(url).find()) {
                continue;
            }
            urls.add(url);
            if (urls.size() >= max) {
                break;
            }
        }
        return new ArrayList<>(urls);
    }

    private Optional<RawItem> fetchArticle(String articleUrl, FeedContext context) {
        try {
            Document page = pageFetcher.fetchDocument(articleUrl);
            return extractArticle(page, articleUrl, context);
        } catch (IOException e) {
            context.report(articleUrl, "Failed to fetch article", e);
            return Optional.empty();
        } catch (RuntimeException e) {
            context.report(articleUrl, "Failed to extract article", e);
            return Optional.empty();
        }
    }

    protected Optional<RawItem> extractArticle(Document page, String articleUrl, FeedContext context) {
        Optional<String> title = firstText(page, getTitleSelectors())
                .or(() -> metaContent(page, "og:title"))
                .or(() -> HtmlText.nonBlank(page.title()));
        if (title.isEmpty()) {
            context.report(articleUrl, "No title found", null);
            return Optional.empty();
        }

        String summary = firstText(page, getSummarySelectors())
                .or(() -> metaContent(page, "og:description"))
                .or(() -> metaContent(page, "description"))
                .map(this::normalizeSummary)
                .orElse("");

        String image = firstContentImage(page)
                .or(() -> metaContent(page, "og:image"))
                .orElse(null);

        return Optional.of(RawItem.builder()
                .link(articleUrl)
                .title(HtmlText.collapseWhitespace(title.get()))
                .summary(summary)
                .image(image)
                .publishedAt(timestampNormalizer.resolve(dateCandidates(page)))
                .build());
    }

    protected String normalizeSummary(String text) {
        String summary = HtmlText.stripCdataMarkers(HtmlText.stripLeadingByline(HtmlText.collapseWhitespace(text)));
        return HtmlText.truncate(summary, SUMMARY_MAX_LENGTH);
    }

    /**
     * Meta published time, JSON-LD datePublished, then the visible date text
     */
    protected List<DateCandidate> dateCandidates(Document page) {
        ZoneId zone = getSiteZone();
        List<DateCandidate> candidates = new ArrayList<>();
        metaContent(page, "article:published_time").ifPresent(text -> candidates.add(DateCandidate.ofText(text, zone)));
        jsonLdDatePublished(page).ifPresent(text -> candidates.add(DateCandidate.ofText(text, zone)));
        for (String selector : getPublishedTimeSelectors()) {
            for (Element element : page.select(selector)) {
                String text = element.hasAttr("datetime") ? element.attr("datetime") : element.text();
                HtmlText.nonBlank(text).ifPresent(value -> candidates.add(DateCandidate.ofText(value, zone)));
            }
        }
        return candidates;
    }

    private Optional<String> firstContentImage(Document page) {
        for (String selector : getContentSelectors()) {
            for (Element content : page.select(selector)) {
                Element img = content.selectFirst("img[src]");
                if (img != null) {
                    String src = img.absUrl("src");
                    Optional<String> url = HtmlText.nonBlank(src.isEmpty() ? img.attr("src") : src);
                    if (url.isPresent()) {
                        return url;
                    }
                }
            }
        }
        return Optional.empty();
    }

    protected static Optional<String> firstText(Document page, List<String> selectors) {
        for (String selector : selectors) {
            for (Element element : page.select(selector)) {
                Optional<String> text = HtmlText.nonBlank(element.text());
                if (text.isPresent()) {
                    return text;
                }
            }
        }
        return Optional.empty();
    }

    protected static Optional<String> metaContent(Document page, String name) {
        Element meta = page.selectFirst("meta[property=" + name + "], meta[name=" + name + "]");
        return meta == null ? Optional.empty() : HtmlText.nonBlank(meta.attr("content"));
    }

    private Optional<String> jsonLdDatePublished(Document page) {
        for (Element script : page.select("script[type=application/ld+json]")) {
            try {
                Optional<String> date = findDatePublished(JsonParser.parseString(script.data()));
                if (date.isPresent()) {
                    return date;
                }
            } catch (JsonParseException | IllegalStateException e) {
                log.debug("Ignoring malformed JSON-LD block: {}", e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static Optional<String> findDatePublished(JsonElement json) {
        if (json == null || json.isJsonNull()) {
            return Optional.empty();
        }
        if (json.isJsonArray()) {
            JsonArray array = json.getAsJsonArray();
            for (JsonElement element : array) {
                Optional<String> date = findDatePublished(element);
                if (date.isPresent()) {
                    return date;
                }
            }
            return Optional.empty();
        }
        if (!json.isJsonObject()) {
            return Optional.empty();
        }
        JsonObject object = json.getAsJsonObject();
        JsonElement datePublished = object.get("datePublished");
        if (datePublished != null && datePublished.isJsonPrimitive()) {
            return HtmlText.nonBlank(datePublished.getAsString());
        }
        return findDatePublished(object.get("@graph"));
    }

    private boolean isExcluded(String url) {
        return scrapingConfig.getExcludedUrlPatterns().stream().anyMatch(url::contains);
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }
}
