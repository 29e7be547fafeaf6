package eu.virtualparadox.docsearch.query.model;

/**
 * @param text    passage text the agent must ground its answer on
 * @param source  human-readable citation
 * @param chunkId identifier of the underlying chunk
 */
public record LookupPassage(String text, String source, String chunkId) {

}
