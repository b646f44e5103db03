package com.newsdigest.backend.model.dto;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Item as produced by a parser, before fingerprinting. Never persisted.
 */
@Value
@Builder
public class RawItem {
    String guid;
    String link;
    String title;
    String summary;
    Instant publishedAt;
    String image;
}
