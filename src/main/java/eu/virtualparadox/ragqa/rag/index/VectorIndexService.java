package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.ingest.model.Chunk;
import eu.virtualparadox.ragqa.rag.index.model.IndexStats;
import eu.virtualparadox.ragqa.rag.index.model.IndexedDocument;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over the vector index used for approximate nearest neighbor (ANN) search.
 * <p>
 * Implementations persist chunk-level vectors alongside the chunk text and identifiers,
 * and provide the operations required by the ingestion and query pipelines:
 * <ul>
 *   <li><b>Upsert</b> : replace all chunks of a document in one atomic operation</li>
 *   <li><b>Delete</b> : remove all chunks belonging to a document, or everything</li>
 *   <li><b>Query</b> : nearest neighbors of a vector, best first</li>
 * </ul>
 * <p>
 * All vectors MUST have the same dimension for the lifetime of the index.
 * Implementations must be safe for concurrent use.
 */
public interface VectorIndexService {

    /**
     * Adds or replaces the indexed representation of all chunks for a document.
     * <p>
     * The previous chunks of {@code docId} are removed and the new chunk+vector pairs added as a
     * single unit: searches see either the old or the new state of the document, never a mix
     * and never a part of it.
     *
     * @param docId   the parent document identifier (non-null, non-blank)
     * @param chunks  ordered list of chunk metadata (non-null, non-empty)
     * @param vectors list of dense vectors, one per chunk, same order and dimension (non-null, non-empty)
     * @throws IOException              if writing to the underlying index fails
     * @throws IllegalArgumentException if parameters are null/empty or sizes/dimensions mismatch
     */
    void upsert(final String docId,
                final List<Chunk> chunks,
                final List<float[]> vectors) throws IOException;

    /**
     * Removes all indexed chunks belonging to the specified document.
     *
     * @param docId the parent document identifier (non-null, non-blank)
     * @return number of chunks removed, {@code 0} if the document was not indexed
     * @throws IOException if the underlying index update fails
     */
    int deleteByDocId(final String docId) throws IOException;

    /**
     * Removes every chunk of every document.
     *
     * @throws IOException if the underlying index update fails
     */
    void deleteAll() throws IOException;

    /**
     * Finds the chunks closest to {@code vector}.
     *
     * @param vector query vector
     * @param k      maximum number of matches
     * @return matches ordered by descending similarity, ties in index order
     * @throws IOException if the search fails
     */
    List<RetrievedMatch> query(final float[] vector, final int k) throws IOException;

    /**
     * Lists the documents that currently have chunks in the index.
     *
     * @return one entry per document, in first-indexed order
     * @throws IOException if the index cannot be read
     */
    List<IndexedDocument> listDocuments() throws IOException;

    /**
     * @return vector count and dimension
     * @throws IOException if the index cannot be read
     */
    IndexStats stats() throws IOException;
}
