package com.codexa.ranking.search;

import com.codexa.ranking.config.Bm25Props;
import com.codexa.ranking.domain.DomainModels.Article;
import com.codexa.ranking.domain.DomainModels.Tag;
import com.codexa.ranking.search.SearchModels.ArticleHit;
import com.codexa.ranking.search.SearchModels.Bm25Document;
import com.codexa.ranking.service.ArticleCatalogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ArticleSearchService {
    private static final Logger log = LoggerFactory.getLogger(ArticleSearchService.class);

    private final Bm25Ranker ranker;
    private final Bm25Props props;
    private final ArticleCatalogService catalog;

    public ArticleSearchService(Bm25Ranker ranker, Bm25Props props, ArticleCatalogService catalog) {
        this.ranker = ranker;
        this.props = props;
        this.catalog = catalog;
    }

    public List<ArticleHit> search(String query, int limit) {
        List<Article> snapshot = catalog.snapshot();
        List<ArticleHit> hits = searchArticlesWithBM25(query, snapshot).stream()
                .limit(Math.max(limit, 0))
                .toList();
        log.debug("Search '{}' matched {} of {} articles", query, hits.size(), snapshot.size());
        return hits;
    }

    /**
     * Ranks {@code articles} against {@code query}. A blank query or an empty list returns every article
     * with score 0; otherwise only positive scores are returned, best first.
     */
    public List<ArticleHit> searchArticlesWithBM25(String query, List<Article> articles) {
        List<Article> source = articles == null ? List.of() : articles;
        List<Bm25Document> documents = source.stream().map(this::toDocument).toList();
        Map<String, Article> byId = source.stream()
                .collect(Collectors.toMap(Article::id, Function.identity(), (a, b) -> a));

        return ranker.rank(query, documents, props.toConfig()).stream()
                .map(scored -> new ArticleHit(byId.get(scored.document().id()), scored.score()))
                .toList();
    }

    private Bm25Document toDocument(Article article) {
        String text = article.title() + " "
                + Objects.toString(article.subtitle(), "") + " "
                + Objects.toString(article.subContent(), "") + " "
                + Objects.toString(article.content(), "");
        List<String> tags = article.tags().stream().map(Tag::name).toList();
        return new Bm25Document(article.id(), text, article.title(), article.subtitle(), tags);
    }
}
