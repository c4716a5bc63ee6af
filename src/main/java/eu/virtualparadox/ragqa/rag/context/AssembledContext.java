package eu.virtualparadox.ragqa.rag.context;

import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;

import java.util.List;

/**
 * @param text    context handed to the generative model
 * @param sources matches whose text is part of {@code text}, in the same order
 */
public record AssembledContext(String text, List<RetrievedMatch> sources) {

    public AssembledContext {
        sources = List.copyOf(sources);
    }

    public static AssembledContext empty() {
        return new AssembledContext("", List.of());
    }
}
