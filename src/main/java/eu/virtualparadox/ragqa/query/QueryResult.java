package eu.virtualparadox.ragqa.query;

import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;

import java.util.List;

/**
 * @param answer  generated answer, or the configured no-information answer
 * @param sources matches that made it into the model's context, best first; empty when no context was used
 * @param timing  per-phase durations
 */
public record QueryResult(String answer, List<RetrievedMatch> sources, QueryTiming timing) {

    public QueryResult {
        sources = List.copyOf(sources);
    }
}
