package com.newsdigest.backend.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.backend.model.dto.IndexManifest;
import com.newsdigest.backend.model.dto.LatestSnapshotDTO;
import com.newsdigest.backend.model.entity.NewsItem;
import com.newsdigest.backend.model.json.IsoInstants;
import com.newsdigest.backend.store.AtomicFileWriter;
import com.newsdigest.backend.store.PartitionDates;
import com.newsdigest.backend.store.PartitionStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes {@code index.json} (available dates and digests) and {@code latest.json} (the most
 * recent partition) from whatever is on disk.
 */
@Slf4j
@Service
public class IndexBuilder {

    public static final String INDEX_FILE = "index.json";
    public static final String LATEST_FILE = "latest.json";

    private final PartitionStore partitionStore;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public IndexBuilder(PartitionStore partitionStore, Clock clock) {
        this.partitionStore = partitionStore;
        this.clock = clock;
    }

    public IndexManifest buildIndex() {
        IndexManifest manifest = scanManifest();
        write(INDEX_FILE, manifest);
        log.info("📚 Index updated: {} dates, {} digests", manifest.getDates().size(), manifest.getDigests().size());
        return manifest;
    }

    /**
     * Snapshot of the most recent partition; nothing is written when there are no partitions.
     */
    public Optional<LatestSnapshotDTO> buildLatest() {
        List<String> dates = partitionStore.listPartitions();
        if (dates.isEmpty()) {
            log.info("No partitions yet, {} not written", LATEST_FILE);
            return Optional.empty();
        }

        String latest = dates.get(0);
        List<NewsItem> items = new ArrayList<>(partitionStore.load(latest).values());
        items.sort(PartitionStore.NEWEST_FIRST);
        LatestSnapshotDTO snapshot = new LatestSnapshotDTO(IsoInstants.format(clock.instant()), latest, items);
        write(LATEST_FILE, snapshot);
        log.info("📌 {} points at {} ({} items)", LATEST_FILE, latest, items.size());
        return Optional.of(snapshot);
    }

    /**
     * Manifest derived from the file names in the output directory, without writing it
     */
    public IndexManifest scanManifest() {
        Path outputDir = partitionStore.getOutputDir();
        List<String> digests = List.of();
        if (Files.isDirectory(outputDir)) {
            try (Stream<Path> files = Files.list(outputDir)) {
                digests = files
                        .map(path -> PartitionDates.keyOfDigestFile(path.getFileName().toString()))
                        .flatMap(Optional::stream)
                        .distinct()
                        .sorted(byDateDescending())
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to scan " + outputDir, e);
            }
        }
        return new IndexManifest(partitionStore.listPartitions(), digests);
    }

    private void write(String fileName, Object value) {
        try {
            AtomicFileWriter.write(partitionStore.getOutputDir().resolve(fileName), objectMapper.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + fileName, e);
        }
    }

    private static Comparator<String> byDateDescending() {
        return Comparator.comparing((String key) -> PartitionDates.parse(key).orElseThrow()).reversed();
    }
}
