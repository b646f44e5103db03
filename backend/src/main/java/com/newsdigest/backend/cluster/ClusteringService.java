package com.newsdigest.backend.cluster;

import com.newsdigest.backend.ai.SummarizationException;
import com.newsdigest.backend.ai.Summarizer;
import com.newsdigest.backend.config.DigestProperties;
import com.newsdigest.backend.model.dto.ClusteringResultDTO;
import com.newsdigest.backend.model.dto.SourceLink;
import com.newsdigest.backend.model.entity.NewsItem;
import com.newsdigest.backend.store.PartitionStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.stereotype.Service;

/**
 * Collapses near-duplicate stories inside each partition into one master item that lists every
 * outlet carrying the story.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusteringService {

    private static final String CLUSTER_SUMMARY_PROMPT = """
            You are an editor at a financial news desk. The articles below come from different outlets \
            and report the same story: "{masterTitle}".

            {articles}

            Write one synthesized summary of 3-4 sentences in {language}. Keep the key facts, figures and names.
            Do not mention the names of outlets or newspapers. Reply with the summary text only.
            """;

    private final PartitionStore partitionStore;
    private final TitleClusterer titleClusterer;
    private final Summarizer summarizer;
    private final DigestProperties digestProperties;

    /**
     * Cluster every partition on disk, most recent first
     */
    public List<ClusteringResultDTO> clusterAll() {
        List<String> partitions = partitionStore.listPartitions();
        log.info("🧩 Clustering {} partitions (threshold {})", partitions.size(), digestProperties.getClusterThreshold());
        if (!summarizer.isAvailable()) {
            log.warn("⚠️ No summarizer configured, cluster summaries will be skipped");
        }

        List<ClusteringResultDTO> results = new ArrayList<>();
        for (String key : partitions) {
            try {
                results.add(clusterPartition(key));
            } catch (RuntimeException e) {
                log.error("❌ Failed to cluster partition {}: {}", key, e.getMessage());
            }
        }
        return results;
    }

    public ClusteringResultDTO clusterPartition(String key) {
        if (!partitionStore.exists(key)) {
            log.warn("Partition {} does not exist, nothing to cluster", key);
            return new ClusteringResultDTO(key, 0, 0, 0, 0);
        }
        ClusteringResultDTO result = partitionStore.merge(key, items -> regroup(key, items));
        log.info("✅ Partition {}: {} items -> {} clusters ({} multi-source, {} summaries)", key,
                result.getItemsBefore(), result.getClusters(), result.getMultiSourceClusters(),
                result.getSummariesGenerated());
        return result;
    }

    private ClusteringResultDTO regroup(String key, LinkedHashMap<String, NewsItem> items) {
        List<NewsItem> ordered = new ArrayList<>(items.values());
        ClusteringResultDTO result = new ClusteringResultDTO(key, ordered.size(), ordered.size(), 0, 0);
        if (ordered.size() < 2) {
            ordered.forEach(item -> item.setClusterCount(item.getSources() != null ? item.getSources().size() : 1));
            return result;
        }

        List<TitleCluster> clusters = titleClusterer.cluster(ordered, digestProperties.getClusterThreshold());
        LinkedHashMap<String, NewsItem> masters = new LinkedHashMap<>();
        for (TitleCluster cluster : clusters) {
            NewsItem master = cluster.getMaster();
            List<SourceLink> sources = collectSources(cluster.getMembers());
            // a summary written for this same set of outlets is still current, whichever member holds it
            Optional<String> currentSummary = cluster.getMembers().stream()
                    .filter(member -> member.getAiSummary() != null && sourceCount(member) == sources.size())
                    .map(NewsItem::getAiSummary)
                    .findFirst();
            master.setSources(sources);
            master.setClusterCount(sources.size());
            currentSummary.ifPresent(master::setAiSummary);

            if (cluster.size() > 1) {
                result.setMultiSourceClusters(result.getMultiSourceClusters() + 1);
                if (currentSummary.isEmpty() && summarizer.isAvailable()) {
                    Optional<String> summary = summarizeCluster(cluster);
                    if (summary.isPresent()) {
                        master.setAiSummary(summary.get());
                        result.setSummariesGenerated(result.getSummariesGenerated() + 1);
                    }
                }
            }
            masters.put(master.getItemId(), master);
        }

        items.clear();
        items.putAll(masters);
        result.setClusters(masters.size());
        return result;
    }

    /**
     * Distinct outlets of every member in member order; a member that already absorbed a cluster
     * contributes its own list
     */
    static List<SourceLink> collectSources(List<NewsItem> members) {
        Set<SourceLink> sources = new LinkedHashSet<>();
        for (NewsItem member : members) {
            if (member.getSources() != null && !member.getSources().isEmpty()) {
                sources.addAll(member.getSources());
            } else {
                sources.add(new SourceLink(member.getSource(), member.getLink()));
            }
        }
        return new ArrayList<>(sources);
    }

    private static int sourceCount(NewsItem item) {
        return item.getSources() != null && !item.getSources().isEmpty() ? item.getSources().size() : 1;
    }

    private Optional<String> summarizeCluster(TitleCluster cluster) {
        String articles = cluster.getMembers().stream()
                .map(member -> "Title: " + member.getTitle() + "\nSummary: " + nullToEmpty(member.getSummary()))
                .collect(Collectors.joining("\n\n"));
        Map<String, Object> variables = Map.of(
                "masterTitle", nullToEmpty(cluster.getMaster().getTitle()),
                "articles", articles,
                "language", digestProperties.getAi().getLanguage());
        String prompt = new PromptTemplate(CLUSTER_SUMMARY_PROMPT).render(variables);
        try {
            return Optional.of(summarizer.summarize(prompt));
        } catch (SummarizationException e) {
            log.warn("⚠️ Cluster summary failed for '{}': {}", cluster.getMaster().getTitle(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
