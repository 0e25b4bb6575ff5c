package com.codexa.ranking;

import com.codexa.ranking.domain.DomainModels.Article;
import com.codexa.ranking.recommendation.ContentSimilarityScorer;
import com.codexa.ranking.recommendation.RecommendationModels.RecommendedArticle;
import com.codexa.ranking.recommendation.RecommendationModels.SimilarityConfig;
import com.codexa.ranking.recommendation.RecommendationModels.SimilarityResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.codexa.ranking.TestArticles.*;
import static org.junit.jupiter.api.Assertions.*;

class ContentSimilarityScorerTest {
    private final ContentSimilarityScorer scorer = new ContentSimilarityScorer(FIXED_CLOCK);
    private final SimilarityConfig config = SimilarityConfig.defaults();

    @Test
    void articleIsFullySimilarToItself() {
        Article a = tagged("a", NOW, "java", "spring");
        List<Article> corpus = List.of(a, tagged("b", NOW, "rust"), tagged("c", NOW, "java"));

        SimilarityResult result = scorer.weightedJaccard(a, a, corpus, config);

        assertEquals(1.0, result.similarity(), 1e-12);
        assertEquals(List.of("java", "spring"), result.sharedTagNames());
    }

    @Test
    void disjointTagsAreNotSimilarAndNotRecommended() {
        Article a = tagged("a", NOW, "java");
        Article d = tagged("d", NOW, "cooking");
        Article c = tagged("c", NOW, "java", "jvm");
        List<Article> corpus = List.of(a, d, c, tagged("e", NOW, "garden"));

        SimilarityResult result = scorer.weightedJaccard(a, d, corpus, config);
        assertEquals(0.0, result.similarity());
        assertTrue(result.sharedTagNames().isEmpty());

        List<RecommendedArticle> recs = scorer.getContentBasedRecommendations(a, corpus, List.of(), 10);
        assertEquals(List.of("c"), recs.stream().map(r -> r.article().id()).toList());
        assertEquals(List.of("java"), recs.get(0).sharedTags());
    }

    @Test
    void tagWeightCombinesRarityAndEngagement() {
        Article popular = new Article("p", "p", null, null, "", tags("java"), 10, 4, 5, NOW, null, null);
        List<Article> corpus = List.of(popular, tagged("x", NOW, "rust"), tagged("y", NOW, "go"));

        double expectedIdf = Math.log(4.0 / 2.0);
        double expectedBoost = 1 + Math.log(1 + 10 * 0.3 + 4 * 0.5 + 5 * 0.2);
        assertEquals(expectedIdf * expectedBoost, scorer.tagWeight("java", popular, corpus, config), 1e-12);
        assertEquals(0.0, scorer.tagWeight("rust", popular, corpus, config));
    }

    @Test
    void recencyPenaltyGrowsWithAgeAndIsCappedAtTwentyPercent() {
        double fresh = scorer.recencyDecay(0.8, NOW, config);
        double halfYear = scorer.recencyDecay(0.8, daysAgo(182.5), config);
        double oneYear = scorer.recencyDecay(0.8, daysAgo(365), config);
        double old = scorer.recencyDecay(0.8, daysAgo(2000), config);

        assertEquals(0.8, fresh, 1e-12);
        assertEquals(0.72, halfYear, 1e-9);
        assertEquals(0.64, oneYear, 1e-9);
        assertEquals(0.64, old, 1e-9);
        assertTrue(fresh >= halfYear && halfYear >= oneYear && oneYear >= old);
    }

    @Test
    void diversityPassLimitsRepeatedTagCombinations() {
        Article reference = tagged("ref", NOW, "x", "y");
        List<Article> corpus = List.of(reference,
                tagged("c1", NOW, "x"), tagged("c2", NOW, "x"), tagged("c3", NOW, "x"), tagged("c4", NOW, "x"),
                tagged("c5", NOW, "y"),
                tagged("f1", NOW, "z"), tagged("f2", NOW, "z"));

        List<RecommendedArticle> four = scorer.getContentBasedRecommendations(reference, corpus, List.of(), 4);
        assertEquals(List.of("c5", "c1"), four.stream().map(r -> r.article().id()).toList());

        List<RecommendedArticle> five = scorer.getContentBasedRecommendations(reference, corpus, List.of(), 5);
        assertEquals(List.of("c5", "c1", "c2"), five.stream().map(r -> r.article().id()).toList());
        assertTrue(five.get(0).similarityScore() > five.get(1).similarityScore());
    }

    @Test
    void excludesReferenceAndExcludedIds() {
        Article reference = tagged("ref", NOW, "x", "y");
        List<Article> corpus = List.of(reference, tagged("c1", NOW, "x"), tagged("c5", NOW, "y"), tagged("f", NOW, "z"));

        List<RecommendedArticle> recs = scorer.getContentBasedRecommendations(reference, corpus, Set.of("c5"), 10);

        assertEquals(List.of("c1"), recs.stream().map(r -> r.article().id()).toList());
    }

    @Test
    void userRecommendationsNeedHistory() {
        assertTrue(scorer.getUserRecommendations(List.of(), List.of(tagged("a", NOW, "x")), 10).isEmpty());
    }

    @Test
    void userRecommendationsMergeSeedsKeepingBestScoreAndSkipOldOrRead() {
        Article seedOne = tagged("s1", daysAgo(3), "java", "spring");
        Article seedTwo = tagged("s2", daysAgo(5), "java");
        Article candidate = tagged("cand", daysAgo(10), "java", "spring");
        Article other = tagged("other", daysAgo(20), "spring", "kotlin");
        Article stale = tagged("stale", daysAgo(400), "java", "spring");
        List<Article> all = List.of(seedOne, seedTwo, candidate, other, stale,
                tagged("f1", NOW, "rust"), tagged("f2", NOW, "go"), tagged("f3", NOW, "zig"));

        List<RecommendedArticle> recs = scorer.getUserRecommendations(List.of(seedOne, seedTwo), all, 10);

        List<String> ids = recs.stream().map(r -> r.article().id()).toList();
        assertTrue(ids.contains("cand"));
        assertFalse(ids.contains("stale"));
        assertFalse(ids.contains("s1"));
        assertFalse(ids.contains("s2"));

        List<Article> recent = all.stream().filter(a -> !a.id().equals("stale")).toList();
        List<String> readIds = List.of("s1", "s2");
        double fromOne = scoreOf(scorer.getContentBasedRecommendations(seedOne, recent, readIds, 10), "cand");
        double fromTwo = scoreOf(scorer.getContentBasedRecommendations(seedTwo, recent, readIds, 10), "cand");
        assertEquals(Math.max(fromOne, fromTwo), scoreOf(recs, "cand"), 1e-12);

        for (int i = 1; i < recs.size(); i++) {
            assertTrue(recs.get(i - 1).similarityScore() >= recs.get(i).similarityScore());
        }
    }

    @Test
    void onlyFiveMostRecentReadsSeedUserRecommendations() {
        List<Article> history = List.of(
                tagged("s0", daysAgo(1), "t0"), tagged("s1", daysAgo(1), "t1"), tagged("s2", daysAgo(1), "t2"),
                tagged("s3", daysAgo(1), "t3"), tagged("s4", daysAgo(1), "t4"), tagged("s5", daysAgo(1), "only6"));
        Article followsFirst = tagged("c0", daysAgo(2), "t0");
        Article followsSixth = tagged("c", daysAgo(2), "only6");
        List<Article> all = new ArrayList<>(history);
        all.addAll(List.of(followsFirst, followsSixth, tagged("f1", NOW, "rust"), tagged("f2", NOW, "go")));

        List<String> ids = scorer.getUserRecommendations(history, all, 10).stream().map(r -> r.article().id()).toList();
        assertTrue(ids.contains("c0"));
        assertFalse(ids.contains("c"));

        List<Article> sixthReadMostRecently = List.of(history.get(5), history.get(0), history.get(1), history.get(2), history.get(3), history.get(4));
        List<String> reordered = scorer.getUserRecommendations(sixthReadMostRecently, all, 10).stream().map(r -> r.article().id()).toList();
        assertTrue(reordered.contains("c"));
    }

    private double scoreOf(List<RecommendedArticle> recs, String id) {
        return recs.stream().filter(r -> r.article().id().equals(id)).findFirst().orElseThrow().similarityScore();
    }
}
