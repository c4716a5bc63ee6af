package eu.virtualparadox.ragqa.query.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import eu.virtualparadox.ragqa.ingest.model.ChunkMetadata;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One source of an answer as returned to clients.
 *
 * @param chunkText       chunk text, cut to {@value #MAX_TEXT_LENGTH} characters plus {@code ...}
 * @param documentId      owning document
 * @param similarityScore cosine similarity rounded to four decimals
 * @param metadata        {@code filename} and {@code chunk_index}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChunkSource(String chunkText,
                          String documentId,
                          double similarityScore,
                          Map<String, Object> metadata) {

    static final int MAX_TEXT_LENGTH = 500;
    private static final String ELLIPSIS = "...";

    public static ChunkSource from(final RetrievedMatch match) {
        final String text = match.chunk().text();
        final String preview = text.length() > MAX_TEXT_LENGTH
                ? StringUtils.truncate(text, MAX_TEXT_LENGTH) + ELLIPSIS
                : text;

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ChunkMetadata.FILENAME, match.chunk().filename());
        metadata.put(ChunkMetadata.CHUNK_INDEX, match.chunk().sequenceIndex());

        return new ChunkSource(preview,
                match.chunk().documentId(),
                Math.round(match.similarityScore() * 10_000.0) / 10_000.0,
                metadata);
    }
}
