package eu.virtualparadox.ragqa.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the source text.
 */
final class ChunkSpan {
    /**
     * Inclusive start offset into the source text.
     */
    final int start;
    /**
     * Exclusive end offset into the source text.
     */
    final int end;

    ChunkSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }

    /**
     * The span's text with surrounding whitespace removed.
     *
     * @param source text the span points into
     * @return stripped text, possibly empty
     */
    String strippedText(final String source) {
        return source.substring(start, end).strip();
    }
}
