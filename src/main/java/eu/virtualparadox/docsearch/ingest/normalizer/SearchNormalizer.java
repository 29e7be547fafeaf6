package eu.virtualparadox.docsearch.ingest.normalizer;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Produces the canonical search form of a text and splits it into tokens.
 *
 * <h2>Canonical form</h2>
 * <ol>
 *   <li>Lowercase (locale independent).</li>
 *   <li>Unicode NFKD decomposition, then removal of combining diacritical marks
 *       ({@code U+0300..U+036F}), so {@code "Café"} and {@code "cafe"} meet.</li>
 *   <li>Lowercase again: compatibility decompositions may produce capitals
 *       (e.g. {@code ㎒} becomes {@code MHz}).</li>
 *   <li>Every run of characters that are neither letters, numbers nor whitespace becomes one space.</li>
 *   <li>Whitespace runs collapse to one space; the result is trimmed.</li>
 * </ol>
 * The transformation is idempotent.
 *
 * <h2>Thread-safety</h2>
 * Stateless; safe to share.
 */
@Component
public class SearchNormalizer {

    /**
     * Tokens shorter than this are dropped as noise.
     */
    public static final int MIN_TOKEN_LENGTH = 2;

    private static final Pattern COMBINING_MARKS = Pattern.compile("[\\u0300-\\u036f]");

    private static final Pattern NON_WORD = Pattern.compile(
            "[^\\p{L}\\p{N}\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Returns the canonical search form of {@code input}.
     *
     * @param input any text, {@code null} is treated as empty
     * @return lowercase, diacritic-free, punctuation-free text with single spaces; never {@code null}
     */
    public String normalize(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String text = input.toLowerCase(Locale.ROOT);
        text = Normalizer.normalize(text, Normalizer.Form.NFKD);
        text = COMBINING_MARKS.matcher(text).replaceAll("");
        text = text.toLowerCase(Locale.ROOT);
        text = NON_WORD.matcher(text).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        return text.strip();
    }

    /**
     * Splits the canonical form of {@code input} on spaces, keeping tokens of at least
     * {@link #MIN_TOKEN_LENGTH} characters. Order and duplicates are preserved.
     *
     * @param input any text, {@code null} is treated as empty
     * @return a new mutable list of tokens, possibly empty
     */
    public List<String> tokenize(final String input) {
        final String normalized = normalize(input);
        final List<String> tokens = new ArrayList<>();
        if (normalized.isEmpty()) {
            return tokens;
        }
        for (final String token : normalized.split(" ")) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
