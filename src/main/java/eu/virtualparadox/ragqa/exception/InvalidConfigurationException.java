package eu.virtualparadox.ragqa.exception;

/** Raised at setup time when chunking, retrieval or context settings are inconsistent. */
public class InvalidConfigurationException extends PipelineException {

    public InvalidConfigurationException(final String message) {
        super(EPipelinePhase.CONFIGURATION, message, "The service is misconfigured.", null);
    }
}
