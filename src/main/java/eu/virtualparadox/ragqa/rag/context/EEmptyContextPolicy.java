package eu.virtualparadox.ragqa.rag.context;

/**
 * What the query pipeline does when no retrieved match passed the score threshold.
 */
public enum EEmptyContextPolicy {
    /** Skip generation and answer with the configured "no relevant information" text. */
    ANSWER_DIRECTLY,
    /** Call the generative model anyway, with an empty context. */
    PROCEED
}
