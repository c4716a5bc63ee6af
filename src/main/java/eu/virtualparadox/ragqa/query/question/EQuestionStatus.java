package eu.virtualparadox.ragqa.query.question;

/**
 * Lifecycle of a question. Declaration order is the order in which a question moves forward.
 */
public enum EQuestionStatus {
    RECEIVED,
    EMBEDDING,
    RETRIEVING,
    ASSEMBLING,
    GENERATING,
    COMPLETE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }
}
