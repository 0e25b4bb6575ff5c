package com.codexa.ranking.trending;

import com.codexa.ranking.config.TrendingProps;
import com.codexa.ranking.domain.DomainModels.Article;
import com.codexa.ranking.service.ArticleCatalogService;
import com.codexa.ranking.trending.TrendingModels.TrendingArticle;
import com.codexa.ranking.trending.TrendingModels.TrendingFilters;
import com.codexa.ranking.trending.TrendingModels.TrendingPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TrendingService {
    private static final Logger log = LoggerFactory.getLogger(TrendingService.class);

    private final HotScoreCalculator calculator;
    private final TrendingProps props;
    private final ArticleCatalogService catalog;

    public TrendingService(HotScoreCalculator calculator, TrendingProps props, ArticleCatalogService catalog) {
        this.calculator = calculator;
        this.props = props;
        this.catalog = catalog;
    }

    public List<TrendingArticle> byPeriod(TrendingPeriod period, int limit) {
        List<Article> snapshot = catalog.snapshot();
        List<TrendingArticle> ranked = calculator.getTrendingArticlesByPeriod(snapshot, period, limit, props.toConfig());
        log.debug("Trending {}: {} of {} articles", period, ranked.size(), snapshot.size());
        return ranked;
    }

    public List<TrendingArticle> withFilters(TrendingFilters filters, int limit) {
        List<Article> snapshot = catalog.snapshot();
        List<TrendingArticle> ranked = calculator.rankTrendingArticles(snapshot, filters, limit, props.toConfig());
        log.debug("Trending with {}: {} of {} articles", filters, ranked.size(), snapshot.size());
        return ranked;
    }
}
