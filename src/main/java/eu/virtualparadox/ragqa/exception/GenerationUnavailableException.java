package eu.virtualparadox.ragqa.exception;

/** Raised when the generative model fails, times out or returns nothing. */
public class GenerationUnavailableException extends PipelineException {

    public GenerationUnavailableException(final String message, final Throwable cause) {
        super(EPipelinePhase.GENERATING, message, "AI service is temporarily unavailable. Please try again later.", cause);
    }
}
