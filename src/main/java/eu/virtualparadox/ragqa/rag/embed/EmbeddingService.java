package eu.virtualparadox.ragqa.rag.embed;

import eu.virtualparadox.ragqa.ingest.model.Chunk;

import java.util.List;

/**
 * Computes dense vector embeddings for text chunks.
 * <p>Implementations must be deterministic for identical input, return vectors of one fixed
 * dimension and be safe for concurrent use.</p>
 */
public interface EmbeddingService {

    /**
     * Embeds the given chunks in batch. Ingestion calls this exactly once per document.
     *
     * @param chunks list of chunks
     * @return list of float vectors, one per chunk, in input order
     * @throws eu.virtualparadox.ragqa.exception.EmbeddingUnavailableException on failure
     */
    List<float[]> embed(List<Chunk> chunks);

    /**
     * Embeds a single query string into dense vector space.
     * <p>
     * Used at query time for semantic search.
     *
     * @param text the query string (non-null, non-blank)
     * @return a dense vector representation of the query
     */
    float[] embedQuery(final String text);
}
