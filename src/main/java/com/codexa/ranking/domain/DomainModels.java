package com.codexa.ranking.domain;

import java.time.Instant;
import java.util.List;

public class DomainModels {
    public record Tag(String id, String name) {}

    /**
     * Read-only article snapshot. {@code subtitle}, {@code subContent}, {@code authorVerified}
     * and {@code qualityScore} are optional and may be null.
     */
    public record Article(String id,
                          String title,
                          String subtitle,
                          String subContent,
                          String content,
                          List<Tag> tags,
                          int likesCount,
                          int commentsCount,
                          int readCount,
                          Instant createdAt,
                          Boolean authorVerified,
                          Double qualityScore) {
        public Article {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }
}
