package com.newsdigest.backend.digest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.backend.ai.SummarizationException;
import com.newsdigest.backend.ai.Summarizer;
import com.newsdigest.backend.config.DigestProperties;
import com.newsdigest.backend.model.dto.DailyDigestDTO;
import com.newsdigest.backend.model.dto.SourceLink;
import com.newsdigest.backend.model.dto.TimelineEntryDTO;
import com.newsdigest.backend.model.entity.NewsItem;
import com.newsdigest.backend.store.AtomicFileWriter;
import com.newsdigest.backend.store.PartitionDates;
import com.newsdigest.backend.store.PartitionStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.stereotype.Service;

/**
 * Builds the daily digest from today's and yesterday's most widely covered stories
 */
@Slf4j
@Service
public class DigestService {

    public static final String DIGEST_FILE = "digest.json";

    private static final String DAILY_DIGEST_PROMPT = """
            You are an editor writing the daily market and economy brief for {date}.

            Headlines from the last two days, the most widely reported first:

            {headlines}

            Write in {language}. Respond with a JSON object only, no commentary, with two keys:
            "summary": an overview of the day in 4-6 sentences.
            "timeline": an array of the 5-8 most important events, newest first. Each event is an object \
            with the keys "time" (HH:mm local time), "title", "content" (1-2 sentences) and "sources" \
            (an array of objects with "name" and "link", copied from the headlines).
            """;

    private static final Pattern CODE_FENCE = Pattern.compile("(?s)```(?:json)?\\s*(.*?)\\s*```");
    private static final DateTimeFormatter HEADLINE_TIME = DateTimeFormatter.ofPattern("HH:mm dd/MM");

    private final PartitionStore partitionStore;
    private final Summarizer summarizer;
    private final DigestProperties digestProperties;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DigestService(PartitionStore partitionStore, Summarizer summarizer,
                         DigestProperties digestProperties, Clock clock) {
        this.partitionStore = partitionStore;
        this.summarizer = summarizer;
        this.digestProperties = digestProperties;
        this.clock = clock;
    }

    /**
     * Generate and write today's digest. Empty when there is nothing to summarize or the model
     * is unavailable or answers with something unusable; no file is written then.
     */
    public Optional<DailyDigestDTO> generateDigest() {
        ZoneId zone = partitionStore.getZone();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        String todayKey = PartitionDates.format(today);

        List<NewsItem> headlines = new ArrayList<>();
        for (LocalDate date : List.of(today, today.minusDays(1))) {
            headlines.addAll(topItems(PartitionDates.format(date)));
        }
        if (headlines.isEmpty()) {
            log.info("📭 No items for {} or the day before, skipping digest", todayKey);
            return Optional.empty();
        }
        if (!summarizer.isAvailable()) {
            log.warn("⚠️ No summarizer configured, skipping digest");
            return Optional.empty();
        }

        log.info("📝 Generating digest for {} from {} headlines", todayKey, headlines.size());
        Map<String, Object> variables = Map.of(
                "date", todayKey,
                "headlines", formatHeadlines(headlines, zone),
                "language", digestProperties.getAi().getLanguage());
        String prompt = new PromptTemplate(DAILY_DIGEST_PROMPT).render(variables);

        DailyDigestDTO digest;
        try {
            digest = parseDigest(summarizer.summarize(prompt), todayKey);
        } catch (SummarizationException e) {
            log.error("❌ Digest generation failed: {}", e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("❌ Digest response is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }

        try {
            byte[] json = objectMapper.writeValueAsBytes(digest);
            AtomicFileWriter.write(partitionStore.getOutputDir().resolve(DIGEST_FILE), json);
            AtomicFileWriter.write(partitionStore.getOutputDir().resolve(PartitionDates.digestFileName(todayKey)), json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write digest for " + todayKey, e);
        }
        log.info("✅ Digest for {} written with {} timeline entries", todayKey, digest.getTimeline().size());
        return Optional.of(digest);
    }

    /**
     * The most widely covered items of one partition
     */
    List<NewsItem> topItems(String key) {
        return partitionStore.load(key).values().stream()
                .sorted(Comparator.comparingInt(DigestService::clusterCountOf).reversed())
                .limit(digestProperties.getItemsPerPartition())
                .toList();
    }

    DailyDigestDTO parseDigest(String response, String dateKey) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(stripCodeFences(response));
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }

        List<TimelineEntryDTO> timeline = new ArrayList<>();
        JsonNode entries = root.path("timeline");
        if (entries.isArray()) {
            for (JsonNode entry : entries) {
                timeline.add(objectMapper.treeToValue(entry, TimelineEntryDTO.class));
            }
        }
        timeline.forEach(entry -> {
            if (entry.getSources() == null) {
                entry.setSources(List.of());
            }
        });

        String updated = OffsetDateTime.now(clock.withZone(partitionStore.getZone()))
                .truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return new DailyDigestDTO(dateKey, root.path("summary").asText(""), timeline, updated);
    }

    static String stripCodeFences(String response) {
        String text = response.trim();
        Matcher fenced = CODE_FENCE.matcher(text);
        return fenced.find() ? fenced.group(1) : text;
    }

    private static String formatHeadlines(List<NewsItem> items, ZoneId zone) {
        return items.stream().map(item -> {
            String time = item.getPublishedAt() != null
                    ? HEADLINE_TIME.format(item.getPublishedAt().atZone(zone)) : "--:--";
            List<SourceLink> sources = item.getSources() != null && !item.getSources().isEmpty()
                    ? item.getSources() : List.of(new SourceLink(item.getSource(), item.getLink()));
            String outlets = sources.stream()
                    .map(source -> source.getName() + " " + source.getLink())
                    .collect(Collectors.joining("; "));
            String summary = item.getAiSummary() != null ? item.getAiSummary() : item.getSummary();
            return "- [" + time + "] " + item.getTitle() + "\n  " + (summary != null ? summary : "")
                    + "\n  Sources: " + outlets;
        }).collect(Collectors.joining("\n"));
    }

    private static int clusterCountOf(NewsItem item) {
        return item.getClusterCount() != null ? item.getClusterCount() : 0;
    }
}
