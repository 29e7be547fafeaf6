package eu.virtualparadox.docsearch.index;

import eu.virtualparadox.docsearch.ingest.model.Chunk;

import java.time.Instant;
import java.util.List;

/**
 * Immutable in-memory collection of every chunk of one tenant, in file then passage order.
 * <p>Never mutated after construction; safe to search from several threads at once.
 * Document changes require building a new instance.</p>
 *
 * @param tenantId owning tenant
 * @param chunks   all chunks of the tenant (unmodifiable copy)
 * @param builtAt  moment the index was assembled
 */
public record KnowledgeIndex(String tenantId, List<Chunk> chunks, Instant builtAt) {

    public KnowledgeIndex {
        chunks = List.copyOf(chunks);
    }

    public int size() {
        return chunks.size();
    }

    /**
     * @return number of distinct source documents contributing at least one chunk
     */
    public long documentCount() {
        return chunks.stream()
                .map(Chunk::docId)
                .distinct()
                .count();
    }
}
