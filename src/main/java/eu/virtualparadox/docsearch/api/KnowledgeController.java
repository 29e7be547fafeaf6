package eu.virtualparadox.docsearch.api;

import eu.virtualparadox.docsearch.index.KnowledgeIndexRegistry;
import eu.virtualparadox.docsearch.index.TenantSummary;
import eu.virtualparadox.docsearch.query.KnowledgeLookupService;
import eu.virtualparadox.docsearch.query.model.LookupResponse;
import eu.virtualparadox.docsearch.search.model.SearchResult;
import eu.virtualparadox.docsearch.search.service.SearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping(path = "/api/tenants", produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
@RequiredArgsConstructor
public class KnowledgeController {

    private static final String DEFAULT_TOP_K = "${docsearch.search.default-top-k:3}";

    private final KnowledgeIndexRegistry registry;
    private final KnowledgeLookupService lookupService;
    private final SearchService searchService;

    @GetMapping
    public List<TenantSummary> tenants() {
        return registry.tenants();
    }

    /**
     * Agent-facing lookup: found passages with citations, or a clarifying not-found message.
     */
    @GetMapping("/{tenantId}/lookup")
    public LookupResponse lookup(@PathVariable("tenantId") final String tenantId,
                                 @RequestParam("query") final String query,
                                 @RequestParam(name = "topK", defaultValue = DEFAULT_TOP_K) final int topK) {
        return lookupService.lookup(tenantId, query, topK);
    }

    @GetMapping("/{tenantId}/search")
    public List<SearchResult> search(@PathVariable("tenantId") final String tenantId,
                                     @RequestParam("query") final String query,
                                     @RequestParam(name = "topK", defaultValue = DEFAULT_TOP_K) final int topK) {
        return searchService.search(registry.require(tenantId), query, topK);
    }

    @PostMapping("/{tenantId}/reindex")
    public TenantSummary reindex(@PathVariable("tenantId") final String tenantId) throws IOException {
        log.info("Reindex requested for tenant {}", tenantId);
        registry.rebuild(tenantId);
        return registry.summary(tenantId);
    }
}
