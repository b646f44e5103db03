package com.newsdigest.backend.scraping;

import static org.assertj.core.api.Assertions.assertThat;

import com.newsdigest.backend.config.DigestProperties;
import com.newsdigest.backend.model.dto.FeedContext;
import com.newsdigest.backend.model.dto.IngestionResultDTO;
import com.newsdigest.backend.model.dto.RawItem;
import com.newsdigest.backend.model.dto.SourceDefinition;
import com.newsdigest.backend.model.entity.NewsItem;
import com.newsdigest.backend.scraper.NewsParser;
import com.newsdigest.backend.scraper.ParserRegistry;
import com.newsdigest.backend.store.PartitionStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestionServiceTest {

    private static final String FEED_A = "https://a.example/rss";
    private static final String FEED_B = "https://b.example/rss";
    private static final String BROKEN = "https://broken.example/rss";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T05:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path outputDir;

    private FakeParser parser;
    private PartitionStore store;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        DigestProperties properties = new DigestProperties();
        properties.setOutputDir(outputDir.toString());
        store = new PartitionStore(properties);
        parser = new FakeParser();
        service = new IngestionService(new ParserRegistry(List.of(parser)), store, Runnable::run, CLOCK);
    }

    @Test
    void ingest_shouldBeIdempotent_whenRunTwiceWithoutForce() throws Exception {
        // GIVEN
        parser.items.put(FEED_A, List.of(
                raw("https://a.example/1", "Fed raises rates by 25bps", "2024-05-01T01:30:00Z"),
                raw("https://a.example/2", "Giá vàng tăng", "2024-05-01T02:30:00Z")));
        List<SourceDefinition> sources = List.of(source("VnExpress", FEED_A));

        // WHEN
        IngestionResultDTO first = service.ingest(sources, false);
        byte[] afterFirst = Files.readAllBytes(outputDir.resolve("05-01-2024.json"));
        IngestionResultDTO second = service.ingest(sources, false);

        // THEN
        assertThat(first.getAdded()).isEqualTo(2);
        assertThat(second.getAdded()).isZero();
        assertThat(second.getSkipped()).isEqualTo(2);
        assertThat(second.getUpdated()).isZero();
        assertThat(Files.readAllBytes(outputDir.resolve("05-01-2024.json"))).isEqualTo(afterFirst);
    }

    @Test
    void ingest_shouldOverwriteInPlace_whenForced() {
        parser.items.put(FEED_A, List.of(raw("https://a.example/1", "Old title", "2024-05-01T01:30:00Z")));
        List<SourceDefinition> sources = List.of(source("VnExpress", FEED_A));
        service.ingest(sources, false);

        parser.items.put(FEED_A, List.of(raw("https://a.example/1", "New title", "2024-05-01T01:30:00Z")));
        IngestionResultDTO result = service.ingest(sources, true);

        assertThat(result.getUpdated()).isEqualTo(1);
        assertThat(result.getAdded()).isZero();
        Map<String, NewsItem> partition = store.load("05-01-2024");
        assertThat(partition).hasSize(1);
        assertThat(partition.values()).extracting(NewsItem::getTitle).containsExactly("New title");
    }

    @Test
    void ingest_shouldTreatSameLinkWithDifferentTitleCasingAsSeen() {
        List<SourceDefinition> sources = List.of(source("VnExpress", FEED_A));
        parser.items.put(FEED_A, List.of(raw("https://a.example/1", "Fed Raises Rates", "2024-05-01T01:30:00Z")));
        service.ingest(sources, false);

        parser.items.put(FEED_A, List.of(raw("https://a.example/1", "fed raises rates", "2024-05-01T01:30:00Z")));
        IngestionResultDTO second = service.ingest(sources, false);

        assertThat(second.getAdded()).isZero();
        assertThat(store.load("05-01-2024")).hasSize(1);
    }

    @Test
    void ingest_shouldRouteItemsByLocalPublicationDate() {
        parser.items.put(FEED_A, List.of(
                raw("https://a.example/late", "Late evening UTC", "2024-05-01T18:30:00Z"),
                raw("https://a.example/early", "Morning", "2024-05-01T03:00:00Z")));

        IngestionResultDTO result = service.ingest(List.of(source("VnExpress", FEED_A)), false);

        assertThat(result.getPartitions()).containsExactly("05-01-2024", "05-02-2024");
        assertThat(store.load("05-02-2024").values()).extracting(NewsItem::getLink)
                .containsExactly("https://a.example/late");
    }

    @Test
    void ingest_shouldKeepFirstOccurrence_ofDuplicatesWithinOneRun() {
        parser.items.put(FEED_A, List.of(raw("https://shared.example/1", "From A", "2024-05-01T01:30:00Z")));
        parser.items.put(FEED_B, List.of(raw("https://shared.example/1", "From B", "2024-05-01T01:30:00Z")));

        IngestionResultDTO result = service.ingest(
                List.of(source("Alpha", FEED_A), source("Beta", FEED_B)), false);

        assertThat(result.getAdded()).isEqualTo(1);
        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(store.load("05-01-2024").values()).extracting(NewsItem::getSource).containsExactly("Alpha");
    }

    @Test
    void ingest_shouldCountSourceFailures_andContinueWithOtherSources() {
        parser.items.put(FEED_A, List.of(raw("https://a.example/1", "Survivor", "2024-05-01T01:30:00Z")));

        IngestionResultDTO result = service.ingest(
                List.of(source("Broken", BROKEN), source("VnExpress", FEED_A)), false);

        assertThat(result.getErrors()).isEqualTo(1);
        assertThat(result.getAdded()).isEqualTo(1);
    }

    @Test
    void ingest_shouldStampRunWithInjectedClock() {
        IngestionResultDTO result = service.ingest(List.of(source("VnExpress", FEED_A)), false);

        assertThat(result.getStartedAt()).isEqualTo("2024-05-01T12:00:00+07:00");
        assertThat(result.getDurationSeconds()).isZero();
    }

    @Test
    void toNewsItem_shouldFallBackGuidToLink_andFingerprintTheLink() {
        NewsItem item = IngestionService.toNewsItem(
                raw("https://example.com/a", "  Tiêu đề   bài  ", "2024-05-01T01:30:00Z"), "VnExpress");

        assertThat(item.getGuid()).isEqualTo("https://example.com/a");
        assertThat(item.getTitle()).isEqualTo("Tiêu đề bài");
        assertThat(item.getItemId()).isEqualTo("c4ed1c218d14a0f15bba7044693ec4b0d68e0a63");
        assertThat(item.getSummary()).isEmpty();
    }

    private static RawItem raw(String link, String title, String published) {
        return RawItem.builder()
                .link(link)
                .title(title)
                .publishedAt(Instant.parse(published))
                .build();
    }

    private static SourceDefinition source(String name, String url) {
        return new SourceDefinition(name, "rss", List.of(url));
    }

    private static class FakeParser implements NewsParser {

        private final Map<String, List<RawItem>> items = new HashMap<>();

        @Override
        public String getSourceType() {
            return "rss";
        }

        @Override
        public Stream<RawItem> parse(String url, FeedContext context) {
            if (BROKEN.equals(url)) {
                context.report(url, "Failed to read feed", new IllegalStateException("HTTP 500"));
                return Stream.empty();
            }
            return items.getOrDefault(url, List.of()).stream();
        }
    }
}
