package eu.virtualparadox.docsearch.ingest.model;

import java.util.List;

/**
 * Immutable retrievable passage produced by chunking one document.
 *
 * @param tenantId   owning tenant
 * @param docId      {@code tenantId:filename}, shared by every chunk of a document
 * @param chunkId    {@code docHash#seq}, unique within a tenant's index
 * @param sourceFile file name without directory, used for citations
 * @param title      first non-blank line of the document, or the file name
 * @param text       trimmed passage text shown to the caller (never empty)
 * @param tokens     normalized tokens of {@code text}, used only for scoring
 */
public record Chunk(String tenantId,
                    String docId,
                    String chunkId,
                    String sourceFile,
                    String title,
                    String text,
                    List<String> tokens) {

    public Chunk {
        tokens = List.copyOf(tokens);
    }
}
