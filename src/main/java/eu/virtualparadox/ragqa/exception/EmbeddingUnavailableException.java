package eu.virtualparadox.ragqa.exception;

/** Raised when the embedding model fails or does not answer in time. */
public class EmbeddingUnavailableException extends PipelineException {

    public EmbeddingUnavailableException(final String message, final Throwable cause) {
        super(EPipelinePhase.EMBEDDING, message, "Embedding service is temporarily unavailable.", cause);
    }
}
