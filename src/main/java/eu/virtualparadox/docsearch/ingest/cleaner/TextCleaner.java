package eu.virtualparadox.docsearch.ingest.cleaner;

import org.springframework.stereotype.Component;

@Component
public class TextCleaner {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Prepares raw file content for chunking while keeping its line structure,
     * which the chunker relies on for titles, paragraphs and table rows.
     *
     * @param input raw document content, may be {@code null}
     * @return cleaned text with {@code \n} line endings; never {@code null}
     */
    public String cleanDocument(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        String text = input;
        if (text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }

        return text
                // CRLF and lone CR -> LF
                .replace("\r\n", "\n")
                .replace('\r', '\n')
                // zero-width and similar -> SPACE
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", " ")
                // non-breaking space -> SPACE
                .replace('\u00A0', ' ')
                // soft hyphen -> SPACE, the tokenizer splits words there
                .replace('\u00AD', ' ')
                // control chars except LF and TAB -> SPACE
                .replaceAll("[\\p{Cc}&&[^\\n\\t]]", " ");
    }
}
