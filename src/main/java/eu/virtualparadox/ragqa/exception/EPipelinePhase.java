package eu.virtualparadox.ragqa.exception;

/**
 * Pipeline stage a failure is attributed to.
 */
public enum EPipelinePhase {
    CONFIGURATION,
    EXTRACTING,
    SEGMENTING,
    EMBEDDING,
    INDEXING,
    RETRIEVING,
    ASSEMBLING,
    GENERATING
}
