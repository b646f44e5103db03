package com.newsdigest.backend.model.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResultDTO {
    private int added;
    private int updated;
    private int skipped;
    private int errors;
    private List<String> partitions = new ArrayList<>();
    private String startedAt;
    private Double durationSeconds;

    public int getTotalProcessed() {
        return added + updated + skipped;
    }
}
