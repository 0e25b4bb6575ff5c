package com.codexa.ranking.search;

import com.codexa.ranking.domain.DomainModels;

import java.util.List;

public class SearchModels {
    /** Indexable view of a document: {@code text} is what gets tokenized, the rest feeds field boosts. */
    public record Bm25Document(String id, String text, String title, String subtitle, List<String> tags) {
        public Bm25Document {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }

    public record ScoredDocument(Bm25Document document, double score) {}

    public record ArticleHit(DomainModels.Article article, double score) {}

    public record Bm25Config(double k1, double b, double titleBoost, double subtitleBoost, double tagBoost) {
        public static Bm25Config defaults() {
            return new Bm25Config(1.5, 0.75, 2.0, 1.5, 1.3);
        }

        public Bm25Config withK1(double k1) {
            return new Bm25Config(k1, b, titleBoost, subtitleBoost, tagBoost);
        }

        public Bm25Config withB(double b) {
            return new Bm25Config(k1, b, titleBoost, subtitleBoost, tagBoost);
        }
    }
}
