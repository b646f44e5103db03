package com.newsdigest.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"dates", "digests"})
public class IndexManifest {
    private List<String> dates;
    private List<String> digests;
}
