package eu.virtualparadox.ragqa.exception;

/** Raised by the context assembler when no match passed the score threshold. */
public class EmptyContextException extends PipelineException {

    public EmptyContextException(final String message) {
        super(EPipelinePhase.ASSEMBLING, message, "No relevant information found.", null);
    }
}
