package eu.virtualparadox.docsearch.ingest.chunker;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits prose into paragraphs on blank lines. Hard-wrapped lines inside a paragraph
 * are joined with a single space so each passage reads as one line.
 */
@Component
public class NarrativePassageFormatter implements PassageFormatter {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WRAPPED_LINE = Pattern.compile("\\s*\\n\\s*", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public EDocumentShape shape() {
        return EDocumentShape.NARRATIVE;
    }

    @Override
    public List<String> format(final String body) {
        final List<String> passages = new ArrayList<>();
        for (final String paragraph : PARAGRAPH_BREAK.split(body)) {
            final String trimmed = UnicodeWhitespace.trim(paragraph);
            if (!trimmed.isEmpty()) {
                passages.add(WRAPPED_LINE.matcher(trimmed).replaceAll(" "));
            }
        }
        return passages;
    }
}
