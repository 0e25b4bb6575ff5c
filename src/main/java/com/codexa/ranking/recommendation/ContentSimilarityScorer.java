package com.codexa.ranking.recommendation;

import com.codexa.ranking.domain.DomainModels.Article;
import com.codexa.ranking.domain.DomainModels.Tag;
import com.codexa.ranking.recommendation.RecommendationModels.RecommendedArticle;
import com.codexa.ranking.recommendation.RecommendationModels.SimilarityConfig;
import com.codexa.ranking.recommendation.RecommendationModels.SimilarityResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Component
public class ContentSimilarityScorer {
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Clock clock;

    public ContentSimilarityScorer(Clock clock) {
        this.clock = clock;
    }

    public double tagWeight(String tagId, Article article, List<Article> corpus, SimilarityConfig config) {
        double tf = hasTag(article, tagId) ? 1 : 0;

        long articlesWithTag = corpus.stream().filter(a -> hasTag(a, tagId)).count();
        double idf = Math.log((corpus.size() + 1.0) / (articlesWithTag + 1.0));

        double engagementBoost = 1 + Math.log(1
                + article.likesCount() * config.likesWeight()
                + article.commentsCount() * config.commentsWeight()
                + article.readCount() * config.readsWeight());

        return tf * idf * engagementBoost;
    }

    public SimilarityResult weightedJaccard(Article a, Article b, List<Article> corpus, SimilarityConfig config) {
        Map<String, Double> weightsA = weights(a, corpus, config);
        Map<String, Double> weightsB = weights(b, corpus, config);

        Set<String> union = new LinkedHashSet<>(weightsA.keySet());
        union.addAll(weightsB.keySet());

        double minSum = 0.0;
        double maxSum = 0.0;
        List<String> shared = new ArrayList<>();
        for (String tagId : union) {
            double weightA = weightsA.getOrDefault(tagId, 0.0);
            double weightB = weightsB.getOrDefault(tagId, 0.0);
            minSum += Math.min(weightA, weightB);
            maxSum += Math.max(weightA, weightB);

            if (weightA > 0 && weightB > 0) {
                String name = tagName(a, tagId).or(() -> tagName(b, tagId)).orElse("");
                if (!name.isEmpty()) shared.add(name);
            }
        }

        double similarity = maxSum > 0 ? minSum / maxSum : 0.0;
        return new SimilarityResult(similarity, List.copyOf(shared));
    }

    /** Applies at most {@code maxRecencyPenalty}, reached once the article is a horizon old. */
    public double recencyDecay(double similarity, Instant createdAt, SimilarityConfig config) {
        double ageFactor = Math.min(1, daysOld(createdAt) / config.recencyHorizonDays()) * config.maxRecencyPenalty();
        return similarity * (1 - ageFactor);
    }

    public List<RecommendedArticle> getContentBasedRecommendations(Article reference,
                                                                   List<Article> candidates,
                                                                   Collection<String> excludeIds,
                                                                   int limit) {
        return getContentBasedRecommendations(reference, candidates, excludeIds, limit, SimilarityConfig.defaults());
    }

    public List<RecommendedArticle> getContentBasedRecommendations(Article reference,
                                                                   List<Article> candidates,
                                                                   Collection<String> excludeIds,
                                                                   int limit,
                                                                   SimilarityConfig config) {
        List<Article> corpus = candidates == null ? List.of() : candidates;
        Set<String> excluded = excludeIds == null ? Set.of() : new HashSet<>(excludeIds);

        List<RecommendedArticle> scored = new ArrayList<>();
        for (Article candidate : corpus) {
            if (candidate.id().equals(reference.id()) || excluded.contains(candidate.id())) continue;

            SimilarityResult result = weightedJaccard(reference, candidate, corpus, config);
            double decayed = recencyDecay(result.similarity(), candidate.createdAt(), config);
            if (decayed > 0 && !result.sharedTagNames().isEmpty()) {
                scored.add(new RecommendedArticle(candidate, decayed, result.sharedTagNames()));
            }
        }
        scored.sort(Comparator.comparingDouble(RecommendedArticle::similarityScore).reversed());

        // near-duplicate tag overlaps only fill the second half of the quota
        List<RecommendedArticle> diverse = new ArrayList<>();
        Set<String> usedCombinations = new HashSet<>();
        for (RecommendedArticle rec : scored) {
            if (diverse.size() >= limit) break;

            String key = rec.sharedTags().stream().sorted().collect(Collectors.joining(","));
            if (!usedCombinations.contains(key) || diverse.size() < limit / 2.0) {
                diverse.add(rec);
                usedCombinations.add(key);
            }
        }
        return diverse;
    }

    public List<RecommendedArticle> getUserRecommendations(List<Article> readArticles, List<Article> allArticles, int limit) {
        return getUserRecommendations(readArticles, allArticles, limit, SimilarityConfig.defaults());
    }

    /**
     * @param readArticles read history, most recently read first; only the first
     *                     {@code seedArticleLimit} entries seed recommendations
     */
    public List<RecommendedArticle> getUserRecommendations(List<Article> readArticles,
                                                           List<Article> allArticles,
                                                           int limit,
                                                           SimilarityConfig config) {
        if (readArticles == null || readArticles.isEmpty()) return List.of();

        List<Article> recent = (allArticles == null ? List.<Article>of() : allArticles).stream()
                .filter(a -> daysOld(a.createdAt()) <= config.candidateWindowDays())
                .toList();
        List<String> readIds = readArticles.stream().map(Article::id).toList();

        Map<String, RecommendedArticle> best = new LinkedHashMap<>();
        for (Article seed : readArticles.stream().limit(config.seedArticleLimit()).toList()) {
            for (RecommendedArticle rec : getContentBasedRecommendations(seed, recent, readIds, limit, config)) {
                RecommendedArticle existing = best.get(rec.article().id());
                if (existing == null || rec.similarityScore() > existing.similarityScore()) {
                    best.put(rec.article().id(), rec);
                }
            }
        }

        return best.values().stream()
                .sorted(Comparator.comparingDouble(RecommendedArticle::similarityScore).reversed())
                .limit(Math.max(limit, 0))
                .toList();
    }

    private Map<String, Double> weights(Article article, List<Article> corpus, SimilarityConfig config) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (Tag tag : article.tags()) {
            weights.put(tag.id(), tagWeight(tag.id(), article, corpus, config));
        }
        return weights;
    }

    private double daysOld(Instant createdAt) {
        return (clock.millis() - createdAt.toEpochMilli()) / MILLIS_PER_DAY;
    }

    private static boolean hasTag(Article article, String tagId) {
        return article.tags().stream().anyMatch(t -> t.id().equals(tagId));
    }

    private static Optional<String> tagName(Article article, String tagId) {
        return article.tags().stream().filter(t -> t.id().equals(tagId)).map(Tag::name).filter(Objects::nonNull).findFirst();
    }
}
