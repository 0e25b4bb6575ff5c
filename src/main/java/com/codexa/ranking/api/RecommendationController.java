package com.codexa.ranking.api;

import com.codexa.ranking.config.SimilarityProps;
import com.codexa.ranking.recommendation.RecommendationModels;
import com.codexa.ranking.recommendation.RecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class RecommendationController {
    private final RecommendationService recommendationService;
    private final SimilarityProps props;

    public RecommendationController(RecommendationService recommendationService, SimilarityProps props) {
        this.recommendationService = recommendationService;
        this.props = props;
    }

    @GetMapping("/articles/{articleId}/related")
    public ResponseEntity<List<RecommendationModels.RecommendedArticle>> related(@PathVariable String articleId,
                                                                                 @RequestParam(required = false) Integer limit) {
        return recommendationService.related(articleId, limit == null ? props.getRelatedLimit() : limit)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/users/{userId}/recommendations")
    public ResponseEntity<List<RecommendationModels.RecommendedArticle>> forUser(@PathVariable String userId,
                                                                                 @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(recommendationService.forUser(userId, limit == null ? props.getUserLimit() : limit));
    }
}
