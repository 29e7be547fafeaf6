package eu.virtualparadox.docsearch.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into a passage.
 * Used to reference the sentences an over-long passage is re-packed from.
 */
final class SentenceSpan {
    /**
     * Inclusive start offset into the passage.
     */
    final int start;
    /**
     * Exclusive end offset into the passage.
     */
    final int end;

    SentenceSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }

    int length() {
        return end - start;
    }
}
