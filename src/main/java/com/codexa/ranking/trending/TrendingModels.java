package com.codexa.ranking.trending;

import com.codexa.ranking.domain.DomainModels;

public class TrendingModels {
    public record TrendingArticle(DomainModels.Article article,
                                  double hotScore,
                                  double engagementScore,
                                  double timeDecay) {}

    /** An article is rejected on engagement only when it misses both minimums; {@code maxAgeDays <= 0} disables the age cut. */
    public record TrendingFilters(int minLikes, int minComments, double maxAgeDays, boolean useLogarithmicDecay) {
        public static TrendingFilters defaults() {
            return new TrendingFilters(1, 0, 90, false);
        }

        public TrendingFilters withMaxAgeDays(double maxAgeDays) {
            return new TrendingFilters(minLikes, minComments, maxAgeDays, useLogarithmicDecay);
        }
    }

    public record HotScoreConfig(double likesWeight,
                                 double commentsWeight,
                                 double readsWeight,
                                 double decayConstantDays,
                                 double gravity,
                                 double verifiedAuthorBoost,
                                 double qualityThreshold,
                                 double qualityBoostPerTenPoints) {
        public static HotScoreConfig defaults() {
            return new HotScoreConfig(2, 3, 1, 7, 1.8, 1.1, 70, 0.05);
        }
    }

    public enum TrendingPeriod {
        ANY(90), WEEK(7), MONTH(30), YEAR(365);

        private final int maxAgeDays;

        TrendingPeriod(int maxAgeDays) {
            this.maxAgeDays = maxAgeDays;
        }

        public int maxAgeDays() {
            return maxAgeDays;
        }

        public static TrendingPeriod parse(String value) {
            if (value == null || value.isBlank()) return ANY;
            for (TrendingPeriod period : values()) {
                if (period.name().equalsIgnoreCase(value.trim())) return period;
            }
            return ANY;
        }
    }
}
