package com.codexa.ranking.recommendation;

import com.codexa.ranking.domain.DomainModels;

import java.util.List;

public class RecommendationModels {
    public record RecommendedArticle(DomainModels.Article article,
                                     double similarityScore,
                                     List<String> sharedTags) {}

    public record SimilarityResult(double similarity, List<String> sharedTagNames) {}

    public record SimilarityConfig(double likesWeight,
                                   double commentsWeight,
                                   double readsWeight,
                                   double maxRecencyPenalty,
                                   double recencyHorizonDays,
                                   int seedArticleLimit,
                                   double candidateWindowDays) {
        public static SimilarityConfig defaults() {
            return new SimilarityConfig(0.3, 0.5, 0.2, 0.2, 365, 5, 365);
        }
    }
}
