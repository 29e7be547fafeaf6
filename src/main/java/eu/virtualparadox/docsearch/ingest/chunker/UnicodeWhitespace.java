package eu.virtualparadox.docsearch.ingest.chunker;

import java.util.regex.Pattern;

/**
 * Trimming that honours every Unicode {@code White_Space} character (U+202F, U+2007, U+3000, ...),
 * not only those {@link Character#isWhitespace(char)} accepts.
 */
final class UnicodeWhitespace {

    private static final Pattern EDGES = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private UnicodeWhitespace() {
    }

    static String trim(final String text) {
        return EDGES.matcher(text).replaceAll("");
    }
}
