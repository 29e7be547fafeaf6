package eu.virtualparadox.docsearch.ingest.chunker;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts each {@code service|price|notes} row into one sentence-like passage, e.g.
 * <pre>
 *     Oil change|$40|synthetic  →  Service: Oil change. Price: $40. Notes: synthetic.
 * </pre>
 * Only the first three columns carry meaning: extra columns are ignored, missing or blank
 * columns are left out of the sentence. Blank lines, {@code #} comment lines and lines
 * without a {@code |} are skipped.
 */
@Component
public class TabularPassageFormatter implements PassageFormatter {

    private static final Pattern COLUMN_SPLIT = Pattern.compile("\\|");
    private static final String COMMENT_PREFIX = "#";

    private static final String[] LABELS = {"Service", "Price", "Notes"};

    @Override
    public EDocumentShape shape() {
        return EDocumentShape.TABULAR;
    }

    @Override
    public List<String> format(final String body) {
        final List<String> passages = new ArrayList<>();
        for (final String rawLine : body.split("\n")) {
            final String line = UnicodeWhitespace.trim(rawLine);
            if (line.isEmpty() || line.startsWith(COMMENT_PREFIX) || line.indexOf('|') < 0) {
                continue;
            }
            passages.add(rowToSentence(line));
        }
        return passages;
    }

    private String rowToSentence(final String row) {
        // -1 keeps trailing empty columns so positions stay aligned
        final String[] columns = COLUMN_SPLIT.split(row, -1);

        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < LABELS.length && i < columns.length; i++) {
            final String value = UnicodeWhitespace.trim(columns[i]);
            if (value.isEmpty()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(LABELS[i]).append(": ").append(value).append('.');
        }
        return sb.toString();
    }
}
