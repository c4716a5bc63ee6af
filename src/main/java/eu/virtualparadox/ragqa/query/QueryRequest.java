package eu.virtualparadox.ragqa.query;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;

/**
 * A question to answer from the indexed documents.
 *
 * @param question       non-blank, at most {@value #MAX_QUESTION_LENGTH} characters
 * @param topK           maximum number of chunks to retrieve, positive
 * @param scoreThreshold minimum cosine similarity a chunk must reach, in {@code [-1, 1]}
 */
public record QueryRequest(String question, int topK, double scoreThreshold) {

    public static final int MAX_QUESTION_LENGTH = 1000;

    public QueryRequest {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question cannot be null or blank");
        }
        if (question.length() > MAX_QUESTION_LENGTH) {
            throw new IllegalArgumentException("question cannot be longer than " + MAX_QUESTION_LENGTH + " characters");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        if (Double.isNaN(scoreThreshold) || scoreThreshold < -1.0 || scoreThreshold > 1.0) {
            throw new IllegalArgumentException("scoreThreshold must be within [-1, 1]");
        }
    }

    /**
     * Creates a request with the configured retrieval defaults.
     */
    public static QueryRequest of(final String question, final ApplicationConfig config) {
        return new QueryRequest(question,
                config.getRetrieval().getTopK(),
                config.getRetrieval().getScoreThreshold());
    }
}
