package com.codexa.ranking.trending;

import com.codexa.ranking.domain.DomainModels.Article;
import com.codexa.ranking.trending.TrendingModels.HotScoreConfig;
import com.codexa.ranking.trending.TrendingModels.TrendingArticle;
import com.codexa.ranking.trending.TrendingModels.TrendingFilters;
import com.codexa.ranking.trending.TrendingModels.TrendingPeriod;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Component
public class HotScoreCalculator {
    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final Clock clock;

    public HotScoreCalculator(Clock clock) {
        this.clock = clock;
    }

    public double engagementScore(Article article, HotScoreConfig config) {
        double engagement = article.likesCount() * config.likesWeight()
                + article.commentsCount() * config.commentsWeight()
                + article.readCount() * config.readsWeight();
        return Math.log(1 + engagement);
    }

    public double exponentialDecay(Instant createdAt, double decayConstantDays) {
        return Math.exp(-daysOld(createdAt) / decayConstantDays);
    }

    public double logarithmicDecay(Instant createdAt, double gravity) {
        return 1 / Math.pow(1 + hoursOld(createdAt) / 12, gravity);
    }

    public TrendingArticle hotScore(Article article, boolean useLogarithmic) {
        return hotScore(article, useLogarithmic, HotScoreConfig.defaults());
    }

    public TrendingArticle hotScore(Article article, boolean useLogarithmic, HotScoreConfig config) {
        double engagement = engagementScore(article, config);
        double decay = useLogarithmic
                ? logarithmicDecay(article.createdAt(), config.gravity())
                : exponentialDecay(article.createdAt(), config.decayConstantDays());

        double hot = engagement * decay;
        if (Boolean.TRUE.equals(article.authorVerified())) {
            hot *= config.verifiedAuthorBoost();
        }
        Double quality = article.qualityScore();
        if (quality != null && quality > config.qualityThreshold()) {
            hot *= 1 + ((quality - config.qualityThreshold()) / 10) * config.qualityBoostPerTenPoints();
        }
        return new TrendingArticle(article, hot, engagement, decay);
    }

    public List<TrendingArticle> rankTrendingArticles(List<Article> articles, TrendingFilters filters, int limit) {
        return rankTrendingArticles(articles, filters, limit, HotScoreConfig.defaults());
    }

    public List<TrendingArticle> rankTrendingArticles(List<Article> articles, TrendingFilters filters, int limit,
                                                      HotScoreConfig config) {
        if (articles == null) return List.of();
        TrendingFilters f = filters == null ? TrendingFilters.defaults() : filters;

        return articles.stream()
                .filter(a -> a.likesCount() >= f.minLikes() || a.commentsCount() >= f.minComments())
                .filter(a -> f.maxAgeDays() <= 0 || daysOld(a.createdAt()) <= f.maxAgeDays())
                .map(a -> hotScore(a, f.useLogarithmicDecay(), config))
                .sorted(Comparator.comparingDouble(TrendingArticle::hotScore).reversed())
                .limit(Math.max(limit, 0))
                .toList();
    }

    public List<TrendingArticle> getTrendingArticlesByPeriod(List<Article> articles, TrendingPeriod period, int limit) {
        return getTrendingArticlesByPeriod(articles, period, limit, HotScoreConfig.defaults());
    }

    public List<TrendingArticle> getTrendingArticlesByPeriod(List<Article> articles, TrendingPeriod period, int limit,
                                                             HotScoreConfig config) {
        TrendingPeriod p = period == null ? TrendingPeriod.ANY : period;
        return rankTrendingArticles(articles, new TrendingFilters(1, 0, p.maxAgeDays(), false), limit, config);
    }

    private double hoursOld(Instant createdAt) {
        return (clock.millis() - createdAt.toEpochMilli()) / MILLIS_PER_HOUR;
    }

    private double daysOld(Instant createdAt) {
        return hoursOld(createdAt) / 24;
    }
}
