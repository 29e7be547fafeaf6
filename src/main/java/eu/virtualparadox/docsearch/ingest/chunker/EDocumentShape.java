package eu.virtualparadox.docsearch.ingest.chunker;

import java.util.List;

/**
 * Whole-document layout classification that decides how the body is cut into passages.
 */
public enum EDocumentShape {

    /**
     * Pipe-delimited rows ({@code service|price|notes}).
     */
    TABULAR,

    /**
     * Prose paragraphs separated by blank lines.
     */
    NARRATIVE;

    private static final char COLUMN_SEPARATOR = '|';

    /**
     * A single line containing {@code |} makes the entire body tabular.
     *
     * @param bodyLines body lines (title line excluded)
     * @return detected shape
     */
    public static EDocumentShape detect(final List<String> bodyLines) {
        for (final String line : bodyLines) {
            if (line.indexOf(COLUMN_SEPARATOR) >= 0) {
                return TABULAR;
            }
        }
        return NARRATIVE;
    }
}
