package com.codexa.ranking.recommendation;

import com.codexa.ranking.config.SimilarityProps;
import com.codexa.ranking.domain.DomainModels.Article;
import com.codexa.ranking.recommendation.RecommendationModels.RecommendedArticle;
import com.codexa.ranking.service.ArticleCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final ContentSimilarityScorer scorer;
    private final SimilarityProps props;
    private final ArticleCatalogService catalog;

    public RecommendationService(ContentSimilarityScorer scorer, SimilarityProps props, ArticleCatalogService catalog) {
        this.scorer = scorer;
        this.props = props;
        this.catalog = catalog;
    }

    /** Empty when the reference article does not exist or is deleted. */
    public Optional<List<RecommendedArticle>> related(String articleId, int limit) {
        List<Article> snapshot = catalog.snapshot();
        Optional<Article> reference = catalog.find(snapshot, articleId);
        if (reference.isEmpty()) {
            log.info("Related articles requested for unknown article {}", articleId);
            return Optional.empty();
        }

        List<RecommendedArticle> recs = scorer.getContentBasedRecommendations(
                reference.get(), snapshot, List.of(), limit, props.toConfig());
        log.debug("Related to {}: {} recommendations from {} candidates", articleId, recs.size(), snapshot.size());
        return Optional.of(recs);
    }

    public List<RecommendedArticle> forUser(String userId, int limit) {
        List<Article> snapshot = catalog.snapshot();
        List<Article> history = catalog.readHistory(userId, snapshot);
        if (history.isEmpty()) {
            log.debug("User {} has no read history", userId);
            return List.of();
        }

        List<RecommendedArticle> recs = scorer.getUserRecommendations(history, snapshot, limit, props.toConfig());
        log.debug("User {}: {} recommendations from {} read articles", userId, recs.size(), history.size());
        return recs;
    }
}
