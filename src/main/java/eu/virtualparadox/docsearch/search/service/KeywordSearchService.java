package eu.virtualparadox.docsearch.search.service;

import eu.virtualparadox.docsearch.index.KnowledgeIndex;
import eu.virtualparadox.docsearch.ingest.model.Chunk;
import eu.virtualparadox.docsearch.ingest.normalizer.SearchNormalizer;
import eu.virtualparadox.docsearch.search.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lexical scorer over a tenant's {@link KnowledgeIndex}.
 * <p>
 * Every chunk is scored against the distinct query tokens:
 * <ul>
 *   <li><b>overlap</b>: 2 per query token found among the chunk tokens</li>
 *   <li><b>title boost</b>: 1 per query token found among the title tokens</li>
 *   <li><b>substring boost</b>: 4 when the normalized query occurs verbatim in the normalized chunk text
 *       (phone numbers, exact phrases)</li>
 * </ul>
 * Chunks scoring zero are dropped, the rest are stably sorted by descending score, so equal scores
 * keep index order.
 * <p>
 * This is a full scan per query, sized for tens to low hundreds of chunks per tenant.
 * The index is only read; concurrent searches need no locking.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class KeywordSearchService implements SearchService {

    static final int OVERLAP_WEIGHT = 2;
    static final int TITLE_WEIGHT = 1;
    static final int SUBSTRING_BOOST = 4;

    private final SearchNormalizer normalizer;

    /**
     * Ranks the chunks of {@code index} against {@code query}.
     *
     * @param index tenant index to scan
     * @param query free-text query
     * @param topK  maximum number of results (must be {@code >= 1})
     * @return at most {@code topK} results by non-increasing score; empty if the query has no tokens
     *         or nothing matches
     */
    @Override
    public List<SearchResult> search(final KnowledgeIndex index, final String query, final int topK) {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(query, "query must not be null");
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive");
        }

        final Set<String> queryTokens = new LinkedHashSet<>(normalizer.tokenize(query));
        log.debug("Query tokens for tenant {}: {}", index.tenantId(), queryTokens);
        if (queryTokens.isEmpty()) {
            return Collections.emptyList();
        }

        final String normalizedQuery = normalizer.normalize(query);

        final List<SearchResult> scored = new ArrayList<>();
        for (final Chunk chunk : index.chunks()) {
            final int score = score(chunk, queryTokens, normalizedQuery);
            if (score > 0) {
                scored.add(toSearchResult(chunk, score));
            }
        }

        // stream sort is stable for ordered streams: ties keep index order
        return scored.stream()
                .sorted(Comparator.comparingInt(SearchResult::score).reversed())
                .limit(topK)
                .toList();
    }

    private int score(final Chunk chunk, final Set<String> queryTokens, final String normalizedQuery) {
        final int overlap = OVERLAP_WEIGHT * countShared(queryTokens, new HashSet<>(chunk.tokens()));
        final int titleBoost = TITLE_WEIGHT * countShared(queryTokens, new HashSet<>(normalizer.tokenize(chunk.title())));
        final int substringBoost = normalizer.normalize(chunk.text()).contains(normalizedQuery) ? SUBSTRING_BOOST : 0;
        return overlap + titleBoost + substringBoost;
    }

    private static int countShared(final Set<String> queryTokens, final Set<String> candidateTokens) {
        int shared = 0;
        for (final String token : queryTokens) {
            if (candidateTokens.contains(token)) {
                shared++;
            }
        }
        return shared;
    }

    private static SearchResult toSearchResult(final Chunk chunk, final int score) {
        return new SearchResult(chunk.chunkId(), chunk.title(), chunk.sourceFile(), chunk.text(), score);
    }
}
