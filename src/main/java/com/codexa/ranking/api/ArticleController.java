package com.codexa.ranking.api;

import com.codexa.ranking.domain.DomainModels;
import com.codexa.ranking.repository.ArticleJdbcRepository;
import com.codexa.ranking.service.ArticleCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api")
public class ArticleController {
    private final ArticleCatalogService catalog;

    public ArticleController(ArticleCatalogService catalog) {
        this.catalog = catalog;
    }

    @PostMapping("/articles")
    public ResponseEntity<Void> save(@RequestBody ArticleRequest request) {
        catalog.saveArticle(new ArticleJdbcRepository.ArticleRow(
                request.id(), request.userId(), request.title(), request.subtitle(), request.subContent(), request.content(),
                request.tags(), request.likesCount(), request.commentsCount(), request.readCount(),
                request.createdAt(), request.qualityScore()));
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/articles/{articleId}")
    public ResponseEntity<Void> delete(@PathVariable String articleId) {
        return catalog.deleteArticle(articleId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/users")
    public ResponseEntity<Void> registerUser(@RequestBody UserRequest request) {
        catalog.registerUser(request.id(), request.verified());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/users/{userId}/reads/{articleId}")
    public ResponseEntity<Void> recordRead(@PathVariable String userId, @PathVariable String articleId) {
        catalog.recordRead(userId, articleId);
        return ResponseEntity.accepted().build();
    }

    public record ArticleRequest(String id,
                                 String userId,
                                 String title,
                                 String subtitle,
                                 String subContent,
                                 String content,
                                 List<DomainModels.Tag> tags,
                                 int likesCount,
                                 int commentsCount,
                                 int readCount,
                                 Instant createdAt,
                                 Double qualityScore) {}

    public record UserRequest(String id, boolean verified) {}
}
