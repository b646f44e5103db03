package com.newsdigest.backend.scraping;

import com.newsdigest.backend.dedup.Fingerprint;
import com.newsdigest.backend.model.dto.FeedContext;
import com.newsdigest.backend.model.dto.IngestionResultDTO;
import com.newsdigest.backend.model.dto.RawItem;
import com.newsdigest.backend.model.dto.SourceDefinition;
import com.newsdigest.backend.model.entity.NewsItem;
import com.newsdigest.backend.scraper.NewsParser;
import com.newsdigest.backend.scraper.ParserRegistry;
import com.newsdigest.backend.scraper.extract.HtmlText;
import com.newsdigest.backend.store.PartitionStore;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fetches every configured source URL in parallel and merges the results into date partitions
 */
@Slf4j
@Service
public class IngestionService {

    private final ParserRegistry parserRegistry;
    private final PartitionStore partitionStore;
    private final Executor ingestionTaskExecutor;
    private final Clock clock;

    public IngestionService(ParserRegistry parserRegistry, PartitionStore partitionStore,
                            @Qualifier("ingestionTaskExecutor") Executor ingestionTaskExecutor, Clock clock) {
        this.parserRegistry = parserRegistry;
        this.partitionStore = partitionStore;
        this.ingestionTaskExecutor = ingestionTaskExecutor;
        this.clock = clock;
    }

    /**
     * Ingest all sources. With {@code forceUpdate} items already stored are overwritten instead of skipped.
     */
    public IngestionResultDTO ingest(List<SourceDefinition> sources, boolean forceUpdate) {
        log.info("🔍 Starting ingestion of {} sources (force update: {})", sources.size(), forceUpdate);
        Instant startTime = clock.instant();
        AtomicInteger errors = new AtomicInteger();

        List<CompletableFuture<List<NewsItem>>> futures = new ArrayList<>();
        for (SourceDefinition source : sources) {
            for (String url : source.getUrls()) {
                futures.add(CompletableFuture.supplyAsync(() -> fetchUrl(source, url, errors), ingestionTaskExecutor));
            }
        }

        // submission order keeps in-run duplicate resolution deterministic
        List<NewsItem> fetched = futures.stream()
                .map(CompletableFuture::join)
                .flatMap(List::stream)
                .toList();

        IngestionResultDTO result = mergeIntoPartitions(fetched, forceUpdate, errors);
        result.setErrors(errors.get());
        result.setStartedAt(startTime.atZone(partitionStore.getZone()).toOffsetDateTime()
                .truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        result.setDurationSeconds(Duration.between(startTime, clock.instant()).toMillis() / 1000.0);

        log.info("✅ Ingestion complete: {} added, {} updated, {} skipped, {} errors across {} partitions in {}s",
                result.getAdded(), result.getUpdated(), result.getSkipped(), result.getErrors(),
                result.getPartitions().size(), result.getDurationSeconds());
        return result;
    }

    /**
     * Parse one source URL into normalized items. Failures are counted, never thrown.
     */
    List<NewsItem> fetchUrl(SourceDefinition source, String url, AtomicInteger errors) {
        FeedContext context = new FeedContext(source.getName(), source.getType(), (failedUrl, message, cause) -> {
            errors.incrementAndGet();
            log.warn("⚠️ [{}] {} ({}): {}", source.getName(), message, failedUrl,
                    cause != null ? cause.getMessage() : "-");
        });

        NewsParser parser = parserRegistry.getParser(source.getType());
        try (Stream<RawItem> items = parser.parse(url, context)) {
            List<NewsItem> result = items.map(raw -> toNewsItem(raw, source.getName())).toList();
            log.info("📰 {} items from {} ({})", result.size(), source.getName(), url);
            return result;
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            log.error("❌ Failed to ingest {} from {}: {}", source.getName(), url, e.getMessage());
            return List.of();
        }
    }

    private IngestionResultDTO mergeIntoPartitions(List<NewsItem> items, boolean forceUpdate, AtomicInteger errors) {
        IngestionResultDTO result = new IngestionResultDTO();
        Set<String> seenInRun = new HashSet<>();
        Map<String, List<NewsItem>> byPartition = new TreeMap<>();

        for (NewsItem item : items) {
            if (!seenInRun.add(item.getItemId())) {
                result.setSkipped(result.getSkipped() + 1);
                continue;
            }
            byPartition.computeIfAbsent(partitionStore.partitionKeyFor(item.getPublishedAt()), k -> new ArrayList<>())
                    .add(item);
        }

        for (Map.Entry<String, List<NewsItem>> partition : byPartition.entrySet()) {
            String key = partition.getKey();
            try {
                MergeCounts counts = partitionStore.merge(key, existing -> applyItems(existing, partition.getValue(), forceUpdate));
                result.setAdded(result.getAdded() + counts.added);
                result.setUpdated(result.getUpdated() + counts.updated);
                result.setSkipped(result.getSkipped() + counts.skipped);
                result.getPartitions().add(key);
                log.info("💾 Partition {}: +{} new, {} updated, {} total", key, counts.added, counts.updated, counts.total);
            } catch (UncheckedIOException e) {
                errors.incrementAndGet();
                log.error("❌ Failed to merge partition {}: {}", key, e.getMessage());
            }
        }
        return result;
    }

    private static MergeCounts applyItems(LinkedHashMap<String, NewsItem> existing, List<NewsItem> items, boolean forceUpdate) {
        MergeCounts counts = new MergeCounts();
        for (NewsItem item : items) {
            if (!existing.containsKey(item.getItemId())) {
                existing.put(item.getItemId(), item);
                counts.added++;
            } else if (forceUpdate) {
                existing.put(item.getItemId(), item);
                counts.updated++;
            } else {
                counts.skipped++;
            }
        }
        counts.total = existing.size();
        return counts;
    }

    /**
     * Normalize a parsed item and assign its fingerprint
     */
    static NewsItem toNewsItem(RawItem raw, String source) {
        String link = HtmlText.nonBlank(raw.getLink()).orElse("");
        String guid = HtmlText.nonBlank(raw.getGuid()).orElse("");
        String title = HtmlText.collapseWhitespace(raw.getTitle());

        return NewsItem.builder()
                .itemId(Fingerprint.of(guid, link, source, title, raw.getPublishedAt()))
                .source(source)
                .title(title)
                .summary(raw.getSummary() != null ? raw.getSummary() : "")
                .link(link)
                .guid(guid.isEmpty() ? link : guid)
                .image(raw.getImage())
                .publishedAt(raw.getPublishedAt())
                .build();
    }

    private static final class MergeCounts {
        private int added;
        private int updated;
        private int skipped;
        private int total;
    }
}
