package eu.virtualparadox.ragqa.exception;

/**
 * Base type for failures raised by the ingestion and query pipelines.
 * <p>Every failure carries the {@link EPipelinePhase} it originated in, so callers can
 * report which stage broke without parsing messages.</p>
 */
public abstract class PipelineException extends RuntimeException {

    private final EPipelinePhase phase;
    private final String userMessage;

    protected PipelineException(final EPipelinePhase phase,
                                final String message,
                                final String userMessage,
                                final Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.userMessage = userMessage;
    }

    public EPipelinePhase getPhase() {
        return phase;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
