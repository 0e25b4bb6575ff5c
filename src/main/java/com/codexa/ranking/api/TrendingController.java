package com.codexa.ranking.api;

import com.codexa.ranking.config.TrendingProps;
import com.codexa.ranking.trending.TrendingModels;
import com.codexa.ranking.trending.TrendingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/trending")
public class TrendingController {
    private final TrendingService trendingService;
    private final TrendingProps props;

    public TrendingController(TrendingService trendingService, TrendingProps props) {
        this.trendingService = trendingService;
        this.props = props;
    }

    @GetMapping
    public ResponseEntity<List<TrendingModels.TrendingArticle>> byPeriod(@RequestParam(required = false, defaultValue = "ANY") String period,
                                                                         @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(trendingService.byPeriod(TrendingModels.TrendingPeriod.parse(period), resolveLimit(limit)));
    }

    @GetMapping("/custom")
    public ResponseEntity<List<TrendingModels.TrendingArticle>> custom(@RequestParam(required = false, defaultValue = "1") int minLikes,
                                                                       @RequestParam(required = false, defaultValue = "0") int minComments,
                                                                       @RequestParam(required = false, defaultValue = "90") double maxAgeDays,
                                                                       @RequestParam(required = false, defaultValue = "false") boolean useLogarithmicDecay,
                                                                       @RequestParam(required = false) Integer limit) {
        var filters = new TrendingModels.TrendingFilters(minLikes, minComments, maxAgeDays, useLogarithmicDecay);
        return ResponseEntity.ok(trendingService.withFilters(filters, resolveLimit(limit)));
    }

    private int resolveLimit(Integer limit) {
        return limit == null ? props.getDefaultLimit() : limit;
    }
}
