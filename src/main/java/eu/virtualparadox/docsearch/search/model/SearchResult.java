package eu.virtualparadox.docsearch.search.model;

/**
 * @param chunkId    Identifier of the matched chunk.
 * @param title      Title of the document the chunk belongs to.
 * @param sourceFile File name of that document, for citation.
 * @param text       The chunk text.
 * @param score      Keyword score (higher = better, always positive).
 */
public record SearchResult(String chunkId, String title, String sourceFile, String text, int score) {

}
