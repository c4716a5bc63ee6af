package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;

import java.util.List;

public interface RetrieverService {

    /**
     * Finds the chunks most similar to a query vector.
     *
     * @param queryVector    embedded question
     * @param topK           maximum number of matches (positive)
     * @param scoreThreshold minimum similarity a match must reach
     * @return at most {@code topK} matches, all scoring at least {@code scoreThreshold}, best first
     * @throws eu.virtualparadox.ragqa.exception.RetrievalUnavailableException if the index cannot be queried
     */
    List<RetrievedMatch> retrieve(final float[] queryVector, final int topK, final double scoreThreshold);

}
