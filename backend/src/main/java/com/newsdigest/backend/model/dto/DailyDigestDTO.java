package com.newsdigest.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"date", "summary", "timeline", "updated"})
public class DailyDigestDTO {
    private String date;
    private String summary;
    private List<TimelineEntryDTO> timeline;
    private String updated;
}
