package eu.virtualparadox.docsearch.query;

import eu.virtualparadox.docsearch.index.KnowledgeIndex;
import eu.virtualparadox.docsearch.index.KnowledgeIndexRegistry;
import eu.virtualparadox.docsearch.query.citation.Citation;
import eu.virtualparadox.docsearch.query.model.LookupPassage;
import eu.virtualparadox.docsearch.query.model.LookupResponse;
import eu.virtualparadox.docsearch.search.model.SearchResult;
import eu.virtualparadox.docsearch.search.service.SearchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers a tenant's knowledge question with the passages the agent may ground on.
 * <p>
 * An empty search result turns into a "not found" payload carrying a clarifying question,
 * so the agent never has to improvise an answer outside the documents.
 */
@Service
@Slf4j
public class KnowledgeLookupService {

    public static final String DEFAULT_NOT_FOUND_MESSAGE =
            "I couldn't find this in the provided documents. Do you want prices, location, opening hours, or services?";

    private final KnowledgeIndexRegistry registry;
    private final SearchService searchService;
    private final String notFoundMessage;

    public KnowledgeLookupService(final KnowledgeIndexRegistry registry,
                                  final SearchService searchService,
                                  @Value("${docsearch.lookup.not-found-message:" + DEFAULT_NOT_FOUND_MESSAGE + "}")
                                  final String notFoundMessage) {
        this.registry = registry;
        this.searchService = searchService;
        this.notFoundMessage = notFoundMessage;
    }

    /**
     * @param tenantId configured tenant
     * @param query    free-text question
     * @param topK     maximum number of passages
     * @return found payload with passages in rank order, or the not-found payload
     * @throws eu.virtualparadox.docsearch.index.UnknownTenantException if the tenant is not configured
     */
    public LookupResponse lookup(final String tenantId, final String query, final int topK) {
        final KnowledgeIndex index = registry.require(tenantId);
        final List<SearchResult> results = searchService.search(index, query, topK);

        if (results.isEmpty()) {
            log.info("No passages for tenant {} and query '{}'", tenantId, query);
            return LookupResponse.notFound(notFoundMessage);
        }

        printDebugResults(results);

        final LookupResponse.LookupResponseBuilder response = LookupResponse.builder().found(true);
        for (final SearchResult result : results) {
            response.passage(new LookupPassage(result.text(), Citation.of(result).asString(), result.chunkId()));
        }
        return response.build();
    }

    private void printDebugResults(final List<SearchResult> results) {
        final StringBuilder sb = new StringBuilder();
        for (final SearchResult r : results) {
            sb.append(" - ").append("[").append(r.score()).append("] ").append(r.text()).append("\n");
        }
        log.debug(" !!! Retrieved passages:\n{}", sb);
    }
}
