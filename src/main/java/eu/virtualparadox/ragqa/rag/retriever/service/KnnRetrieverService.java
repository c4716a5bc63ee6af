package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.exception.RetrievalUnavailableException;
import eu.virtualparadox.ragqa.rag.index.VectorIndexService;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Semantic retrieval over the vector index with score-threshold filtering.
 * <p>
 * Steps:
 * <ol>
 *   <li>Ask the index for {@code topK * candidateMultiplier} nearest neighbors</li>
 *   <li>Stable-sort them by descending score (ties keep the index's order)</li>
 *   <li>Drop every candidate scoring below the threshold</li>
 *   <li>Keep the first {@code topK} of what is left</li>
 * </ol>
 * Filtering happens before truncation, so a candidate that passes the threshold is never lost to
 * one that does not. Index failures are not retried.
 */
@Service
@Slf4j
public final class KnnRetrieverService implements RetrieverService {

    private final VectorIndexService vectorIndexService;
    private final int candidateMultiplier;

    @Autowired
    public KnnRetrieverService(final VectorIndexService vectorIndexService, final ApplicationConfig config) {
        this(vectorIndexService, config.getRetrieval().getCandidateMultiplier());
    }

    public KnnRetrieverService(final VectorIndexService vectorIndexService, final int candidateMultiplier) {
        if (candidateMultiplier < 1) {
            throw new IllegalArgumentException("candidateMultiplier must be at least 1");
        }
        this.vectorIndexService = vectorIndexService;
        this.candidateMultiplier = candidateMultiplier;
    }

    @Override
    public List<RetrievedMatch> retrieve(final float[] queryVector, final int topK, final double scoreThreshold) {
        if (queryVector == null || queryVector.length == 0) {
            throw new IllegalArgumentException("queryVector must not be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }

        final int candidates = (int) Math.min((long) topK * candidateMultiplier, Integer.MAX_VALUE);
        final List<RetrievedMatch> raw;
        try {
            raw = vectorIndexService.query(queryVector, candidates);
        } catch (final Exception e) {
            throw new RetrievalUnavailableException("Similarity index query failed", e);
        }

        final List<RetrievedMatch> ranked = new ArrayList<>(raw);
        ranked.sort(Comparator.comparingDouble(RetrievedMatch::similarityScore).reversed());

        final List<RetrievedMatch> matches = ranked.stream()
                .filter(m -> m.similarityScore() >= scoreThreshold)
                .limit(topK)
                .toList();

        if (matches.isEmpty()) {
            log.warn("No chunks retrieved ({} candidates, threshold {})", raw.size(), scoreThreshold);
        } else {
            log.info("Retrieved {} chunks. Top score: {}", matches.size(), matches.get(0).similarityScore());
        }
        return matches;
    }
}
