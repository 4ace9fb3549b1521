package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.model.DateRange;
import it.aw.hybridsearch.model.HybridResult;
import it.aw.hybridsearch.model.SearchFilters;
import it.aw.hybridsearch.model.SearchOptions;
import it.aw.hybridsearch.model.SearchOutcome;
import it.aw.hybridsearch.service.SearchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Ricerca ibrida sui documenti di un tenant.
 *
 * Esempio:
 *   curl -X POST http://localhost:8889/api/search \
 *        -H "X-Tenant-Id: acme" -H "Content-Type: application/json" \
 *        -d '{"query": "cloud security compliance", "topK": 5, "categoryTags": ["rfp"]}'
 *
 * Con "hybridSearch": false la ricerca è solo vettoriale (minScore di default 0.7).
 */
@RestController
@RequestMapping("/api/search")
public class SearchController {

    private final SearchService searchService;

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping
    public ResponseEntity<SearchResponse> search(
            @RequestHeader(value = Tenants.HEADER, required = false) String tenantHeader,
            @RequestBody SearchRequest request) {
        String tenantId = Tenants.resolve(tenantHeader, request.tenantId());
        DateRange dateRange = request.dateFrom() != null || request.dateTo() != null
                ? new DateRange(request.dateFrom(), request.dateTo())
                : null;
        SearchFilters filters = new SearchFilters(tenantId, request.documentId(), request.documentIds(),
                request.categoryTags(), dateRange);
        SearchOptions options = SearchOptions.of(request.topK(), request.minScore(), request.hybridSearch(),
                request.vectorWeight(), request.keywordWeight(), request.keywords(),
                request.keywordBoost(), request.enableBm25());

        SearchOutcome outcome = searchService.search(request.query(), filters, options);
        List<String> explanations = Boolean.TRUE.equals(request.explain())
                ? outcome.results().stream().map(r -> searchService.explain(r, options)).toList()
                : null;
        List<HybridResult> results = outcome.results();
        return ResponseEntity.ok(new SearchResponse(results, outcome.source(),
                searchService.stats(results), explanations));
    }
}
