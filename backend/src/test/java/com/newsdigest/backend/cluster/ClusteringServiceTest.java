package com.newsdigest.backend.cluster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.newsdigest.backend.ai.SummarizationException;
import com.newsdigest.backend.ai.Summarizer;
import com.newsdigest.backend.config.DigestProperties;
import com.newsdigest.backend.model.dto.ClusteringResultDTO;
import com.newsdigest.backend.model.dto.FeedContext;
import com.newsdigest.backend.model.dto.RawItem;
import com.newsdigest.backend.model.dto.SourceDefinition;
import com.newsdigest.backend.model.dto.SourceLink;
import com.newsdigest.backend.model.entity.NewsItem;
import com.newsdigest.backend.scraper.NewsParser;
import com.newsdigest.backend.scraper.ParserRegistry;
import com.newsdigest.backend.scraping.IngestionService;
import com.newsdigest.backend.store.PartitionStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ClusteringServiceTest {

    private static final String KEY = "05-01-2024";

    @TempDir
    Path outputDir;

    @Mock
    private Summarizer summarizer;

    private PartitionStore store;
    private ClusteringService clusteringService;

    @BeforeEach
    void setUp() {
        DigestProperties properties = new DigestProperties();
        properties.setOutputDir(outputDir.toString());
        properties.setClusterThreshold(0.25);
        store = new PartitionStore(properties);
        clusteringService = new ClusteringService(store, new TitleClusterer(), summarizer, properties);
    }

    @Test
    void clusterPartition_shouldCollapseSimilarStoriesIntoMaster() {
        // GIVEN
        seedFedPartition();
        when(summarizer.isAvailable()).thenReturn(true);
        when(summarizer.summarize(anyString())).thenReturn("Cục Dự trữ Liên bang tăng lãi suất.");

        // WHEN
        ClusteringResultDTO result = clusteringService.clusterPartition(KEY);

        // THEN
        assertThat(result.getItemsBefore()).isEqualTo(3);
        assertThat(result.getClusters()).isEqualTo(2);
        assertThat(result.getMultiSourceClusters()).isEqualTo(1);
        assertThat(result.getSummariesGenerated()).isEqualTo(1);

        LinkedHashMap<String, NewsItem> stored = store.load(KEY);
        assertThat(stored).containsOnlyKeys("fed-1", "bakery");
        NewsItem master = stored.get("fed-1");
        assertThat(master.getClusterCount()).isEqualTo(2);
        assertThat(master.getSources()).containsExactly(
                new SourceLink("VnExpress", "https://vnexpress.net/fed-1"),
                new SourceLink("CafeF", "https://cafef.vn/fed-2"));
        assertThat(master.getAiSummary()).isEqualTo("Cục Dự trữ Liên bang tăng lãi suất.");

        NewsItem single = stored.get("bakery");
        assertThat(single.getClusterCount()).isEqualTo(1);
        assertThat(single.getSources()).containsExactly(new SourceLink("VnEconomy", "https://vneconomy.vn/bakery"));
        assertThat(single.getAiSummary()).isNull();
    }

    @Test
    void clusterPartition_shouldPromptWithEveryMember() {
        seedFedPartition();
        when(summarizer.isAvailable()).thenReturn(true);
        when(summarizer.summarize(anyString())).thenReturn("summary");

        clusteringService.clusterPartition(KEY);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(summarizer).summarize(prompt.capture());
        assertThat(prompt.getValue())
                .contains("Fed raises rates by 25bps")
                .contains("Fed hikes rates a quarter point")
                .contains("Vietnamese")
                .doesNotContain("Local bakery");
    }

    @Test
    void clusterPartition_shouldOmitSummary_whenSummarizerFails() {
        seedFedPartition();
        when(summarizer.isAvailable()).thenReturn(true);
        when(summarizer.summarize(anyString())).thenThrow(new SummarizationException("rate limited"));

        ClusteringResultDTO result = clusteringService.clusterPartition(KEY);

        assertThat(result.getSummariesGenerated()).isZero();
        NewsItem master = store.load(KEY).get("fed-1");
        assertThat(master.getClusterCount()).isEqualTo(2);
        assertThat(master.getAiSummary()).isNull();
    }

    @Test
    void clusterPartition_shouldSkipSummaries_whenSummarizerUnavailable() {
        seedFedPartition();
        when(summarizer.isAvailable()).thenReturn(false);

        clusteringService.clusterPartition(KEY);

        verify(summarizer, never()).summarize(anyString());
        assertThat(store.load(KEY)).hasSize(2);
    }

    @Test
    void clusterPartition_shouldBeStable_whenRunTwice() {
        // GIVEN
        seedFedPartition();
        when(summarizer.isAvailable()).thenReturn(true);
        when(summarizer.summarize(anyString())).thenReturn("summary");
        clusteringService.clusterPartition(KEY);
        LinkedHashMap<String, NewsItem> firstRun = store.load(KEY);

        // WHEN
        ClusteringResultDTO second = clusteringService.clusterPartition(KEY);

        // THEN
        assertThat(store.load(KEY)).isEqualTo(firstRun);
        assertThat(second.getSummariesGenerated()).isZero();
        verify(summarizer, times(1)).summarize(anyString());
    }

    @Test
    void clusterPartition_shouldKeepDistinctSources_whenCrawlReaddsAbsorbedMember() {
        // GIVEN
        when(summarizer.isAvailable()).thenReturn(true);
        when(summarizer.summarize(anyString())).thenReturn("summary");
        Map<String, List<RawItem>> feeds = Map.of(
                "https://vnexpress.net/rss", List.of(
                        raw("https://vnexpress.net/fed-1", "Fed raises rates by 25bps", 3),
                        raw("https://vnexpress.net/bakery", "Local bakery wins award", 1)),
                "https://cafef.vn/rss", List.of(
                        raw("https://cafef.vn/fed-2", "Fed hikes rates a quarter point", 2)));
        IngestionService ingestionService = new IngestionService(
                new ParserRegistry(List.of(new FixedFeedParser(feeds))), store, Runnable::run,
                Clock.fixed(Instant.parse("2024-05-01T05:00:00Z"), ZoneOffset.UTC));
        List<SourceDefinition> sources = List.of(
                new SourceDefinition("VnExpress", "rss", List.of("https://vnexpress.net/rss")),
                new SourceDefinition("CafeF", "rss", List.of("https://cafef.vn/rss")));

        // WHEN
        for (int run = 0; run < 3; run++) {
            ingestionService.ingest(sources, false);
            clusteringService.clusterPartition(KEY);
        }

        // THEN
        LinkedHashMap<String, NewsItem> stored = store.load(KEY);
        assertThat(stored).hasSize(2);
        NewsItem master = stored.values().iterator().next();
        assertThat(master.getLink()).isEqualTo("https://vnexpress.net/fed-1");
        assertThat(master.getSources()).containsExactly(
                new SourceLink("VnExpress", "https://vnexpress.net/fed-1"),
                new SourceLink("CafeF", "https://cafef.vn/fed-2"));
        assertThat(master.getClusterCount()).isEqualTo(2);
        assertThat(master.getAiSummary()).isEqualTo("summary");
        verify(summarizer, times(1)).summarize(anyString());
    }

    @Test
    void collectSources_shouldDropRepeatedOutlets() {
        NewsItem master = item("m", "Fed", "VnExpress", "https://a", 2);
        master.setSources(List.of(new SourceLink("VnExpress", "https://a"), new SourceLink("CafeF", "https://b")));
        NewsItem readded = item("r", "Fed", "CafeF", "https://b", 1);

        assertThat(ClusteringService.collectSources(List.of(master, readded))).containsExactly(
                new SourceLink("VnExpress", "https://a"),
                new SourceLink("CafeF", "https://b"));
    }

    @Test
    void clusterPartition_shouldMarkSingleItemPartition() {
        store.save(KEY, Map.of("only", item("only", "Only story", "VnExpress", "https://x/only", 1)));

        ClusteringResultDTO result = clusteringService.clusterPartition(KEY);

        assertThat(result.getClusters()).isEqualTo(1);
        assertThat(store.load(KEY).get("only").getClusterCount()).isEqualTo(1);
    }

    @Test
    void clusterPartition_shouldReturnZeros_whenPartitionMissing() {
        ClusteringResultDTO result = clusteringService.clusterPartition("01-01-2020");

        assertThat(result.getItemsBefore()).isZero();
        assertThat(result.getClusters()).isZero();
        assertThat(store.exists("01-01-2020")).isFalse();
    }

    @Test
    void collectSources_shouldReuseSourcesOfEarlierMasters() {
        NewsItem earlierMaster = item("m", "Fed", "VnExpress", "https://a", 1);
        earlierMaster.setSources(List.of(new SourceLink("VnExpress", "https://a"), new SourceLink("CafeF", "https://b")));
        NewsItem plain = item("p", "Fed", "VnEconomy", "https://c", 2);

        assertThat(ClusteringService.collectSources(List.of(earlierMaster, plain))).containsExactly(
                new SourceLink("VnExpress", "https://a"),
                new SourceLink("CafeF", "https://b"),
                new SourceLink("VnEconomy", "https://c"));
    }

    private void seedFedPartition() {
        LinkedHashMap<String, NewsItem> items = new LinkedHashMap<>();
        items.put("fed-1", item("fed-1", "Fed raises rates by 25bps", "VnExpress", "https://vnexpress.net/fed-1", 3));
        items.put("fed-2", item("fed-2", "Fed hikes rates a quarter point", "CafeF", "https://cafef.vn/fed-2", 2));
        items.put("bakery", item("bakery", "Local bakery wins award", "VnEconomy", "https://vneconomy.vn/bakery", 1));
        store.save(KEY, items);
    }

    private static RawItem raw(String link, String title, int hour) {
        return RawItem.builder()
                .link(link)
                .title(title)
                .summary("Summary of " + title)
                .publishedAt(Instant.parse("2024-05-01T0" + hour + ":00:00Z"))
                .build();
    }

    private static NewsItem item(String id, String title, String source, String link, int hour) {
        return NewsItem.builder()
                .itemId(id)
                .title(title)
                .summary("Summary of " + title)
                .source(source)
                .link(link)
                .guid(link)
                .publishedAt(Instant.parse("2024-05-01T0" + hour + ":00:00Z"))
                .build();
    }

    private static class FixedFeedParser implements NewsParser {

        private final Map<String, List<RawItem>> feeds;

        FixedFeedParser(Map<String, List<RawItem>> feeds) {
            this.feeds = feeds;
        }

        @Override
        public String getSourceType() {
            return "rss";
        }

        @Override
        public Stream<RawItem> parse(String url, FeedContext context) {
            return feeds.getOrDefault(url, List.of()).stream();
        }
    }
}
