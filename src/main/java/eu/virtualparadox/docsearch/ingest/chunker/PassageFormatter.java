package eu.virtualparadox.docsearch.ingest.chunker;

import java.util.List;

/**
 * Turns a document body of one {@link EDocumentShape} into raw passages.
 * <p>
 * Implementations never throw on malformed content; they degrade to fewer or shorter
 * passages. Passages may still exceed the chunk limit, the {@link Chunker} re-splits them.
 */
public interface PassageFormatter {

    EDocumentShape shape();

    List<String> format(final String body);

}
