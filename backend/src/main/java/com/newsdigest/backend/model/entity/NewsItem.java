package com.newsdigest.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.newsdigest.backend.model.dto.SourceLink;
import com.newsdigest.backend.model.json.UtcInstantDeserializer;
import com.newsdigest.backend.model.json.UtcInstantSerializer;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted unit of a date partition.
 * <p>
 * Field names on disk follow the partition file format ({@code item_id}, {@code published},
 * {@code cluster_count}, ...). {@code image} is always written, the clustering fields only when set.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"item_id", "source", "title", "summary", "link", "guid", "image", "published",
        "sources", "cluster_count", "ai_summary"})
public class NewsItem {

    @JsonProperty("item_id")
    private String itemId;

    private String source;

    private String title;

    private String summary;

    private String link;

    private String guid;

    private String image;

    @JsonProperty("published")
    @JsonSerialize(using = UtcInstantSerializer.class)
    @JsonDeserialize(using = UtcInstantDeserializer.class)
    private Instant publishedAt;

    // Set by the clustering pass
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<SourceLink> sources;

    @JsonProperty("cluster_count")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Integer clusterCount;

    @JsonProperty("ai_summary")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String aiSummary;
}
