package com.newsdigest.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.newsdigest.backend.model.entity.NewsItem;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"generated_at", "date", "items"})
public class LatestSnapshotDTO {
    @JsonProperty("generated_at")
    private String generatedAt;
    private String date;
    private List<NewsItem> items;
}
