package com.codexa.ranking.service;

import com.codexa.ranking.domain.DomainModels.Article;
import com.codexa.ranking.repository.ArticleJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ArticleCatalogService {
    private static final Logger log = LoggerFactory.getLogger(ArticleCatalogService.class);

    private final ArticleJdbcRepository repository;
    private final Clock clock;

    public ArticleCatalogService(ArticleJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void registerUser(String userId, boolean verified) {
        repository.saveUser(userId, verified);
    }

    public void saveArticle(ArticleJdbcRepository.ArticleRow row) {
        repository.saveArticle(row.createdAt() == null ? row.withCreatedAt(clock.instant()) : row);
        log.debug("Stored article {} with {} tags", row.id(), row.tags().size());
    }

    public boolean deleteArticle(String articleId) {
        return repository.markDeleted(articleId);
    }

    public void recordRead(String userId, String articleId) {
        repository.recordRead(userId, articleId, clock.instant());
    }

    public List<Article> snapshot() {
        List<Article> articles = repository.loadActiveArticles();
        log.debug("Loaded snapshot of {} active articles", articles.size());
        return articles;
    }

    public Optional<Article> find(List<Article> snapshot, String articleId) {
        return snapshot.stream().filter(a -> a.id().equals(articleId)).findFirst();
    }

    /** Read history resolved against {@code snapshot}, most recently read first; deleted articles drop out. */
    public List<Article> readHistory(String userId, List<Article> snapshot) {
        Map<String, Article> byId = snapshot.stream().collect(Collectors.toMap(Article::id, Function.identity(), (a, b) -> a));
        return repository.loadReadArticleIds(userId).stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .toList();
    }
}
