package com.codexa.ranking.api;

import com.codexa.ranking.config.Bm25Props;
import com.codexa.ranking.search.ArticleSearchService;
import com.codexa.ranking.search.SearchModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/search")
public class SearchController {
    private final ArticleSearchService searchService;
    private final Bm25Props props;

    public SearchController(ArticleSearchService searchService, Bm25Props props) {
        this.searchService = searchService;
        this.props = props;
    }

    @GetMapping
    public ResponseEntity<List<SearchModels.ArticleHit>> search(@RequestParam(name = "q", required = false, defaultValue = "") String query,
                                                                @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(searchService.search(query, limit == null ? props.getDefaultLimit() : limit));
    }
}
