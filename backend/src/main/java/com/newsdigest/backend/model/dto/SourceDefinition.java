package com.newsdigest.backend.model.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the {@code sources} list in the source configuration file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceDefinition {
    private String name;
    private String type = "rss";
    private List<String> urls = new ArrayList<>();
}
