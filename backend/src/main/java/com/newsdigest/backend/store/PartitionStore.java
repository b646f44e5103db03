package com.newsdigest.backend.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.backend.config.DigestProperties;
import com.newsdigest.backend.model.entity.NewsItem;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * File-backed store of date partitions, one {@code MM-dd-yyyy.json} object per local date,
 * keyed by item id.
 */
@Slf4j
@Component
public class PartitionStore {

    /**
     * Newest first; ties broken by item id so identical content always serializes identically
     */
    public static final Comparator<NewsItem> NEWEST_FIRST = Comparator
            .comparing(NewsItem::getPublishedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(NewsItem::getItemId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final Path outputDir;
    private final ZoneId zone;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public PartitionStore(DigestProperties digestProperties) {
        this.outputDir = digestProperties.outputPath();
        this.zone = digestProperties.zoneId();
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Key of the partition an item published at {@code publishedAt} belongs to
     */
    public String partitionKeyFor(Instant publishedAt) {
        return PartitionDates.format(LocalDate.ofInstant(publishedAt, zone));
    }

    public Path partitionPath(String key) {
        return outputDir.resolve(key + PartitionDates.JSON_SUFFIX);
    }

    public boolean exists(String key) {
        return Files.isRegularFile(partitionPath(key));
    }

    /**
     * Load a partition. Missing, unreadable or malformed files load as empty; never throws.
     */
    public LinkedHashMap<String, NewsItem> load(String key) {
        LinkedHashMap<String, NewsItem> items = new LinkedHashMap<>();
        Path path = partitionPath(key);
        if (!Files.isRegularFile(path)) {
            return items;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readAllBytes(path));
        } catch (IOException e) {
            log.warn("⚠️ Partition {} is unreadable, treating as empty: {}", path, e.getMessage());
            return items;
        }
        if (root == null || !root.isObject()) {
            log.warn("⚠️ Partition {} is not a JSON object, treating as empty", path);
            return items;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                NewsItem item = objectMapper.treeToValue(field.getValue(), NewsItem.class);
                if (item == null) {
                    continue;
                }
                if (item.getItemId() == null || item.getItemId().isBlank()) {
                    item.setItemId(field.getKey());
                }
                items.put(field.getKey(), item);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping malformed entry {} in {}: {}", field.getKey(), path, e.getMessage());
            }
        }
        return items;
    }

    /**
     * Replace a partition with {@code items}, sorted newest first, through an atomic file move.
     */
    public void save(String key, Map<String, NewsItem> items) {
        List<NewsItem> sorted = new ArrayList<>(items.values());
        sorted.sort(NEWEST_FIRST);
        LinkedHashMap<String, NewsItem> ordered = new LinkedHashMap<>();
        for (NewsItem item : sorted) {
            ordered.put(item.getItemId(), item);
        }

        try {
            AtomicFileWriter.write(partitionPath(key), objectMapper.writeValueAsBytes(ordered));
            log.debug("Saved partition {} ({} items)", key, ordered.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save partition " + key, e);
        }
    }

    /**
     * Load, mutate and save one partition while holding that partition's lock.
     */
    public <T> T merge(String key, Function<LinkedHashMap<String, NewsItem>, T> mutation) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            LinkedHashMap<String, NewsItem> items = load(key);
            T result = mutation.apply(items);
            save(key, items);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keys of all partition files with a valid date name, most recent first.
     */
    public List<String> listPartitions() {
        if (!Files.isDirectory(outputDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(outputDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> PartitionDates.keyOfPartitionFile(path.getFileName().toString()))
                    .flatMap(Optional::stream)
                    .distinct()
                    .sorted(Comparator.comparing((String key) -> PartitionDates.parse(key).orElseThrow()).reversed())
                    .toList();
        } catch (IOException e) {
            log.error("❌ Failed to list partitions in {}: {}", outputDir, e.getMessage());
            return List.of();
        }
    }
}
