package eu.virtualparadox.ragqa.exception;

/** Raised when the similarity index cannot be queried or times out. Never retried internally. */
public class RetrievalUnavailableException extends PipelineException {

    public RetrievalUnavailableException(final String message, final Throwable cause) {
        super(EPipelinePhase.RETRIEVING, message, "Search is temporarily unavailable. Please try again.", cause);
    }
}
