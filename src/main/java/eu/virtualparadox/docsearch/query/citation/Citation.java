package eu.virtualparadox.docsearch.query.citation;

import eu.virtualparadox.docsearch.search.model.SearchResult;
import org.apache.commons.lang3.StringUtils;

public class Citation {

    private static final String PREFIX = "Source: ";
    private static final String SEPARATOR = " — ";

    public final String title;
    public final String sourceFile;

    public Citation(final String title, final String sourceFile) {
        this.title = title;
        this.sourceFile = sourceFile;
    }

    public static Citation of(final SearchResult result) {
        return new Citation(result.title(), result.sourceFile());
    }

    /**
     * Spoken/printed form, e.g. {@code Source: Autolife Price List — pricing.txt}.
     */
    public String asString() {
        return StringUtils.join(PREFIX, title, SEPARATOR, sourceFile);
    }
}
