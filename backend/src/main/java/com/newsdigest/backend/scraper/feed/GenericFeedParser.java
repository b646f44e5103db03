package com.newsdigest.backend.scraper.feed;

import com.newsdigest.backend.model.dto.FeedContext;
import com.newsdigest.backend.model.dto.RawItem;
import com.newsdigest.backend.scraper.NewsParser;
import com.newsdigest.backend.scraper.extract.DateCandidate;
import com.newsdigest.backend.scraper.extract.HtmlText;
import com.newsdigest.backend.scraper.extract.TimestampNormalizer;
import com.newsdigest.backend.scraper.fetch.PageFetcher;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.filter.Filters;
import org.jdom2.input.SAXBuilder;
import org.springframework.stereotype.Component;

/**
 * Standard RSS/Atom feeds read with Rome. Subclasses adjust summary and image extraction for
 * feeds with quirks.
 */
@Slf4j
@Component
public class GenericFeedParser implements NewsParser {

    public static final String TYPE = "rss";

    private static final String MEDIA_NAMESPACE = "http://search.yahoo.com/mrss/";
    private static final List<String> DATE_ELEMENTS = List.of("published", "pubDate", "updated", "date");
    private static final Set<String> ENTRY_ELEMENTS = Set.of("item", "entry");

    protected final PageFetcher pageFetcher;
    protected final TimestampNormalizer timestampNormalizer;

    public GenericFeedParser(PageFetcher pageFetcher, TimestampNormalizer timestampNormalizer) {
        this.pageFetcher = pageFetcher;
        this.timestampNormalizer = timestampNormalizer;
    }

    @Override
    public String getSourceType() {
        return TYPE;
    }

    @Override
    public Stream<RawItem> parse(String url, FeedContext context) {
        FeedDocument document;
        try {
            document = readFeed(url);
        } catch (IOException | JDOMException | FeedException | IllegalArgumentException e) {
            context.report(url, "Failed to read feed", e);
            return Stream.empty();
        }

        List<SyndEntry> entries = document.getFeed().getEntries();
        List<List<String>> dateTexts = document.getDateTexts();
        log.debug("Feed {} has {} entries", url, entries.size());
        return IntStream.range(0, entries.size())
                .mapToObj(i -> toRawItem(entries.get(i), i < dateTexts.size() ? dateTexts.get(i) : List.of(), url, context))
                .flatMap(Optional::stream);
    }

    /**
     * Fetch and parse a feed. The raw date strings of each entry are collected from the XML
     * before Rome maps it, because Rome keeps only the dates it managed to parse.
     */
    protected FeedDocument readFeed(String url) throws IOException, JDOMException, FeedException {
        byte[] body = pageFetcher.fetchBytes(url);
        Document xml;
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(body))) {
            SAXBuilder builder = new SAXBuilder();
            builder.setExpandEntities(false);
            xml = builder.build(reader);
        }
        List<List<String>> dateTexts = rawDateTexts(xml);
        SyndFeed feed = new SyndFeedInput().build(xml);
        if (dateTexts.size() != feed.getEntries().size()) {
            log.debug("Entry count mismatch in {}, ignoring raw date text", url);
            dateTexts = List.of();
        }
        return new FeedDocument(feed, dateTexts);
    }

    private Optional<RawItem> toRawItem(SyndEntry entry, List<String> dateTexts, String feedUrl, FeedContext context) {
        try {
            String title = HtmlText.collapseWhitespace(entry.getTitle());
            String link = HtmlText.nonBlank(entry.getLink()).orElse("");
            if (title.isEmpty() && link.isEmpty()) {
                context.report(feedUrl, "Skipping entry without title and link", null);
                return Optional.empty();
            }

            String description = entry.getDescription() != null ? entry.getDescription().getValue() : null;
            String content = contentHtml(entry);

            return Optional.of(RawItem.builder()
                    .guid(HtmlText.nonBlank(entry.getUri()).orElse(null))
                    .link(link)
                    .title(title)
                    .summary(extractSummary(description, content))
                    .image(extractImage(entry, description, content).orElse(null))
                    .publishedAt(timestampNormalizer.resolve(dateCandidates(entry, dateTexts)))
                    .build());
        } catch (RuntimeException e) {
            context.report(feedUrl, "Skipping malformed entry", e);
            return Optional.empty();
        }
    }

    /**
     * Plain-text summary from the entry description
     */
    protected String extractSummary(String descriptionHtml, String contentHtml) {
        return HtmlText.clean(descriptionHtml);
    }

    /**
     * Media attachment, then the first image in the content, then in the description
     */
    protected Optional<String> extractImage(SyndEntry entry, String descriptionHtml, String contentHtml) {
        return mediaUrl(entry)
                .or(() -> HtmlText.firstImage(contentHtml))
                .or(() -> HtmlText.firstImage(descriptionHtml));
    }

    protected Optional<String> mediaUrl(SyndEntry entry) {
        List<Element> markup = entry.getForeignMarkup();
        for (String name : List.of("content", "thumbnail")) {
            Optional<String> url = findMediaElement(markup, name);
            if (url.isPresent()) {
                return url;
            }
        }
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            String type = enclosure.getType();
            if ((type == null || type.startsWith("image/")) && HtmlText.nonBlank(enclosure.getUrl()).isPresent()) {
                return Optional.of(enclosure.getUrl().trim());
            }
        }
        return Optional.empty();
    }

    private Optional<String> findMediaElement(List<Element> elements, String name) {
        for (Element element : elements) {
            if (!MEDIA_NAMESPACE.equals(element.getNamespaceURI())) {
                continue;
            }
            if (name.equals(element.getName())) {
                Optional<String> url = HtmlText.nonBlank(element.getAttributeValue("url"));
                if (url.isPresent()) {
                    return url;
                }
            }
            // media:group wraps media:content
            if ("group".equals(element.getName())) {
                Optional<String> nested = findMediaElement(element.getChildren(), name);
                if (nested.isPresent()) {
                    return nested;
                }
            }
        }
        return Optional.empty();
    }

    private static String contentHtml(SyndEntry entry) {
        StringBuilder html = new StringBuilder();
        for (SyndContent content : entry.getContents()) {
            if (content.getValue() != null) {
                html.append(content.getValue());
            }
        }
        return html.length() > 0 ? html.toString() : null;
    }

    private static List<DateCandidate> dateCandidates(SyndEntry entry, List<String> dateTexts) {
        List<DateCandidate> candidates = new ArrayList<>();
        dateTexts.forEach(text -> candidates.add(DateCandidate.ofText(text)));
        candidates.add(DateCandidate.ofDate(entry.getPublishedDate()));
        candidates.add(DateCandidate.ofDate(entry.getUpdatedDate()));
        return candidates;
    }

    /**
     * Date strings of every item/entry element in document order, by element priority
     */
    private static List<List<String>> rawDateTexts(Document xml) {
        List<List<String>> result = new ArrayList<>();
        for (Element entry : xml.getRootElement().getDescendants(Filters.element())) {
            if (!ENTRY_ELEMENTS.contains(entry.getName())) {
                continue;
            }
            List<String> texts = new ArrayList<>();
            for (String name : DATE_ELEMENTS) {
                for (Element child : entry.getChildren()) {
                    if (name.equals(child.getName()) && !child.getTextTrim().isEmpty()) {
                        texts.add(child.getTextTrim());
                    }
                }
            }
            result.add(texts);
        }
        return result;
    }

    @Value
    protected static class FeedDocument {
        SyndFeed feed;
        List<List<String>> dateTexts;
    }
}
