package eu.virtualparadox.ragqa.exception;

/**
 * Raised when a document cannot be extracted, segmented or written to the index.
 * The index is left as it was before the attempt.
 */
public class IngestionFailedException extends PipelineException {

    private final String documentId;

    public IngestionFailedException(final String documentId,
                                    final EPipelinePhase phase,
                                    final String message,
                                    final Throwable cause) {
        super(phase, message, "Failed to process document", cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
