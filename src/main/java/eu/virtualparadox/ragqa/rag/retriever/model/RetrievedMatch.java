package eu.virtualparadox.ragqa.rag.retriever.model;

import eu.virtualparadox.ragqa.ingest.model.Chunk;

/**
 * A chunk returned for one query, never persisted.
 *
 * @param chunk           the matched chunk as stored in the index
 * @param similarityScore cosine similarity between query and chunk vectors, in {@code [-1, 1]} (higher = better)
 */
public record RetrievedMatch(Chunk chunk, float similarityScore) {

}
