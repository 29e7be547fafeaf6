package eu.virtualparadox.docsearch.index;

import java.nio.file.Path;
import java.time.Instant;

/**
 * @param tenantId  tenant identifier
 * @param folder    configured document folder
 * @param documents number of documents that produced chunks
 * @param chunks    number of chunks in the current index
 * @param builtAt   when the current index was built
 */
public record TenantSummary(String tenantId, String folder, long documents, int chunks, Instant builtAt) {

    public static TenantSummary of(final KnowledgeIndex index, final Path folder) {
        return new TenantSummary(index.tenantId(), folder.toString(), index.documentCount(), index.size(), index.builtAt());
    }
}
