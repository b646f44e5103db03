package com.newsdigest.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusteringResultDTO {
    private String partition;
    private int itemsBefore;
    private int clusters;
    private int multiSourceClusters;
    private int summariesGenerated;
}
