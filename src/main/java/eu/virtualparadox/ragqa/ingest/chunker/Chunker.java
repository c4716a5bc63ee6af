package eu.virtualparadox.ragqa.ingest.chunker;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.exception.InvalidConfigurationException;
import eu.virtualparadox.ragqa.ingest.model.Chunk;
import eu.virtualparadox.ragqa.ingest.model.ChunkMetadata;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Boundary-aware text {@code Chunker} that produces overlapping, fixed-size chunks for RAG pipelines.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Windowing:</strong> a cursor walks the text; each candidate chunk ends at most
 *       {@code chunkSize} characters after the cursor.</li>
 *   <li><strong>Boundary preference:</strong> unless the window reaches the end of the text, the cut
 *       point is moved back to just after the nearest boundary character found within the last
 *       {@code lookback} characters of the window. Candidates are ranked by kind, not by distance:
 *       a period anywhere in the lookback window beats a newline, which beats any other whitespace.
 *       Without a candidate the window is cut as is.</li>
 *   <li><strong>Overlap:</strong> the next window starts {@code overlap} characters before the previous
 *       cut. The cursor always moves forward; if the overlap would not advance it, the next window
 *       starts at the previous cut.</li>
 *   <li><strong>Emission:</strong> each window is stripped of surrounding whitespace; whitespace-only
 *       windows are skipped. Internal whitespace is never normalized.</li>
 * </ul>
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * This component is stateless after construction and thus thread-safe. For a given input
 * {@code (documentId, text)} output is deterministic.
 *
 * <h2>Complexity</h2>
 * Linear in the input length times {@code chunkSize / (chunkSize - overlap)}; the boundary search is a
 * single backward pass over at most {@code lookback} characters per chunk.
 */
@Component
public class Chunker {

    /** Default lookback window for the boundary search. */
    public static final int DEFAULT_LOOKBACK = 100;

    /**
     * Boundary kinds in priority order. The first kind found in the lookback window wins,
     * regardless of how far back it is.
     */
    private static final List<IntPredicate> BOUNDARY_PRIORITY = List.of(
            c -> c == '.',
            c -> c == '\n',
            Character::isWhitespace
    );

    private final int chunkSize;
    private final int overlap;
    private final int lookback;

    @Autowired
    public Chunker(final ApplicationConfig config) {
        this(config.getChunking().getSize(),
                config.getChunking().getOverlap(),
                config.getChunking().getLookback());
    }

    public Chunker(final int chunkSize, final int overlap) {
        this(chunkSize, overlap, DEFAULT_LOOKBACK);
    }

    /**
     * Constructs a {@code Chunker}.
     *
     * @param chunkSize maximum characters per chunk (must be {@code > 0})
     * @param overlap   characters shared by consecutive chunks (must be {@code >= 0} and {@code < chunkSize})
     * @param lookback  size of the boundary search window (must be {@code > 0})
     * @throws InvalidConfigurationException if constraints are violated
     */
    public Chunker(final int chunkSize, final int overlap, final int lookback) {
        if (chunkSize <= 0) {
            throw new InvalidConfigurationException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new InvalidConfigurationException("overlap must be non-negative and less than chunkSize");
        }
        if (lookback <= 0) {
            throw new InvalidConfigurationException("lookback must be positive");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.lookback = lookback;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    /**
     * Convenience API without document-level metadata.
     *
     * @param documentId document identifier (non-blank)
     * @param text       input text (non-null, may be empty)
     * @return ordered chunks covering {@code text}
     */
    public List<Chunk> segment(final String documentId, final String text) {
        return segment(documentId, text, Map.of());
    }

    /**
     * Splits {@code text} into overlapping chunks.
     * <p>Every chunk receives the given document-level metadata plus its own
     * {@code chunk_index}, {@code total_chunks}, {@code start_offset} and {@code end_offset}.</p>
     *
     * @param documentId document identifier (non-blank)
     * @param text       input text (non-null, may be empty)
     * @param metadata   document-level attributes copied into every chunk
     * @return ordered chunks, {@code sequenceIndex} starting at 0; empty for empty or blank text
     * @throws IllegalArgumentException if inputs are invalid
     */
    public List<Chunk> segment(final String documentId,
                               final String text,
                               final Map<String, String> metadata) {
        validateInputs(documentId, text, metadata);

        final List<ChunkSpan> spans = split(text);
        final List<Chunk> result = new ArrayList<>(spans.size());
        for (int seq = 0; seq < spans.size(); seq++) {
            final ChunkSpan span = spans.get(seq);

            final Map<String, String> chunkMetadata = new HashMap<>(metadata);
            chunkMetadata.put(ChunkMetadata.CHUNK_INDEX, String.valueOf(seq));
            chunkMetadata.put(ChunkMetadata.TOTAL_CHUNKS, String.valueOf(spans.size()));
            chunkMetadata.put(ChunkMetadata.START_OFFSET, String.valueOf(span.start));
            chunkMetadata.put(ChunkMetadata.END_OFFSET, String.valueOf(span.end));

            result.add(new Chunk(documentId,
                    buildChunkId(documentId, seq),
                    seq,
                    span.strippedText(text),
                    span.start,
                    span.end,
                    chunkMetadata));
        }
        return result;
    }

    /**
     * Walks the text and returns the spans of all non-blank chunks.
     */
    private List<ChunkSpan> split(final String text) {
        final List<ChunkSpan> spans = new ArrayList<>();
        final int length = text.length();
        if (length == 0) {
            return spans;
        }

        int start = 0;
        while (true) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                end = preferBoundary(text, start, end);
            }

            final ChunkSpan span = new ChunkSpan(start, end);
            if (!span.strippedText(text).isEmpty()) {
                spans.add(span);
            }

            if (end == length) {
                return spans;
            }

            final int next = end - overlap;
            start = next <= start ? end : next;
        }
    }

    /**
     * Moves a cut point back to just after the best boundary character in
     * {@code [max(end - lookback, start), end)}.
     *
     * @return adjusted end, always {@code > start}; {@code end} itself if no boundary was found
     */
    private int preferBoundary(final String text, final int start, final int end) {
        final int windowStart = Math.max(end - lookback, start);
        final int[] nearest = new int[BOUNDARY_PRIORITY.size()];
        Arrays.fill(nearest, -1);

        for (int i = end - 1; i >= windowStart && nearest[0] < 0; i--) {
            final char c = text.charAt(i);
            for (int p = 0; p < BOUNDARY_PRIORITY.size(); p++) {
                if (nearest[p] < 0 && BOUNDARY_PRIORITY.get(p).test(c)) {
                    nearest[p] = i;
                }
            }
        }

        for (final int position : nearest) {
            if (position >= 0) {
                return position + 1;
            }
        }
        return end;
    }

    /**
     * @param documentId must be non-null and non-blank
     * @param text       must be non-null (may be blank)
     * @param metadata   must be non-null (may be empty)
     * @throws IllegalArgumentException if any constraint is violated
     */
    private void validateInputs(final String documentId, final String text, final Map<String, String> metadata) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null, pass an empty map instead");
        }
    }

    private static String buildChunkId(final String documentId, final int seq) {
        return documentId + "_chunk_" + seq;
    }
}
