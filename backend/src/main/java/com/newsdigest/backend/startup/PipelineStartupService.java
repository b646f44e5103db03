package com.newsdigest.backend.startup;

import com.newsdigest.backend.cluster.ClusteringService;
import com.newsdigest.backend.digest.DigestService;
import com.newsdigest.backend.index.IndexBuilder;
import com.newsdigest.backend.model.dto.IngestionResultDTO;
import com.newsdigest.backend.model.dto.SourceDefinition;
import com.newsdigest.backend.scraping.IngestionService;
import com.newsdigest.backend.scraping.SourceConfigService;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Runs crawl, cluster, digest and index once the application is ready.
 * <p>
 * Arguments: {@code --config=<path>} selects the source configuration, {@code --force} overwrites
 * items that are already stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineStartupService {

    private final SourceConfigService sourceConfigService;
    private final IngestionService ingestionService;
    private final ClusteringService clusteringService;
    private final DigestService digestService;
    private final IndexBuilder indexBuilder;

    @Value("${app.pipeline.auto-run:true}")
    private boolean autoRun;

    @Value("${app.pipeline.config-path:config.yaml}")
    private String defaultConfigPath;

    @Value("${app.pipeline.cluster-enabled:true}")
    private boolean clusterEnabled;

    @Value("${app.pipeline.digest-enabled:true}")
    private boolean digestEnabled;

    @Value("${app.pipeline.index-enabled:true}")
    private boolean indexEnabled;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!autoRun) {
            log.info("🔕 Pipeline auto-run disabled via configuration");
            return;
        }
        ApplicationArguments arguments = new DefaultApplicationArguments(event.getArgs());
        runPipeline(resolveConfigPath(arguments), isForceUpdate(arguments));
    }

    /**
     * Run every enabled stage. Only a broken source configuration aborts the run.
     */
    public IngestionResultDTO runPipeline(Path configPath, boolean forceUpdate) {
        log.info("🚀 ===== NEWS DIGEST PIPELINE STARTED =====");
        log.info("📅 Start Time: {}", LocalDateTime.now());

        List<SourceDefinition> sources = sourceConfigService.loadSources(configPath);

        log.info("🔍 PHASE 1: Ingestion");
        IngestionResultDTO result = ingestionService.ingest(sources, forceUpdate);
        log.info("🎯 Added: {} | Updated: {} | Skipped: {} | Errors: {} | Total: {}",
                result.getAdded(), result.getUpdated(), result.getSkipped(), result.getErrors(),
                result.getTotalProcessed());

        if (clusterEnabled) {
            log.info("🧩 PHASE 2: Clustering");
            try {
                clusteringService.clusterAll();
            } catch (RuntimeException e) {
                log.error("❌ Clustering failed: {}", e.getMessage());
            }
        }

        if (digestEnabled) {
            log.info("📝 PHASE 3: Daily digest");
            try {
                digestService.generateDigest();
            } catch (RuntimeException e) {
                log.error("❌ Digest failed: {}", e.getMessage());
            }
        }

        if (indexEnabled) {
            log.info("📚 PHASE 4: Index");
            try {
                indexBuilder.buildIndex();
                indexBuilder.buildLatest();
            } catch (RuntimeException e) {
                log.error("❌ Index build failed: {}", e.getMessage());
            }
        }

        log.info("🎉 ===== NEWS DIGEST PIPELINE COMPLETED =====");
        return result;
    }

    private Path resolveConfigPath(ApplicationArguments arguments) {
        List<String> values = arguments.getOptionValues("config");
        if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
            return Path.of(values.get(0));
        }
        return Path.of(defaultConfigPath);
    }

    private static boolean isForceUpdate(ApplicationArguments arguments) {
        if (!arguments.containsOption("force")) {
            return false;
        }
        List<String> values = arguments.getOptionValues("force");
        return values == null || values.isEmpty() || !"false".equalsIgnoreCase(values.get(0));
    }
}
