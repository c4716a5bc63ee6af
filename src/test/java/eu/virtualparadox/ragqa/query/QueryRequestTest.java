package eu.virtualparadox.ragqa.query;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryRequestTest {

    @Test
    @DisplayName("Defaults come from the retrieval configuration")
    void defaultsFromConfig() {
        QueryRequest request = QueryRequest.of("What is RAG?", new ApplicationConfig());
        assertEquals(5, request.topK());
        assertEquals(0.5, request.scoreThreshold());
    }

    @Test
    @DisplayName("Blank, missing and overlong questions are rejected")
    void questionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new QueryRequest(null, 5, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new QueryRequest("  ", 5, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new QueryRequest("x".repeat(1001), 5, 0.5));
        assertDoesNotThrow(() -> new QueryRequest("x".repeat(1000), 5, 0.5));
    }

    @Test
    @DisplayName("Top-k must be positive and the threshold a cosine value")
    void retrievalValidation() {
        assertThrows(IllegalArgumentException.class, () -> new QueryRequest("q", 0, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new QueryRequest("q", 5, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new QueryRequest("q", 5, Double.NaN));
    }
}
