package eu.virtualparadox.ragqa.rag.embed;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OnnxEmbeddingServiceTest {

    @Test
    @DisplayName("Mean pooling averages only attended tokens")
    void meanPoolIgnoresPadding() {
        float[][] tokens = {
                {1f, 2f},
                {3f, 4f},
                {100f, 100f}
        };
        float[] pooled = OnnxEmbeddingService.meanPool(tokens, new long[]{1, 1, 0});
        assertArrayEquals(new float[]{2f, 3f}, pooled, 1e-6f);
    }

    @Test
    @DisplayName("Mean pooling without attended tokens yields zeros")
    void meanPoolNothingAttended() {
        float[] pooled = OnnxEmbeddingService.meanPool(new float[][]{{5f, 5f}}, new long[]{0});
        assertArrayEquals(new float[]{0f, 0f}, pooled);
    }

    @Test
    @DisplayName("Normalization yields unit length and leaves zero vectors alone")
    void normalize() {
        float[] vec = {3f, 4f};
        OnnxEmbeddingService.normalize(vec);
        assertArrayEquals(new float[]{0.6f, 0.8f}, vec, 1e-6f);

        float[] zero = {0f, 0f};
        OnnxEmbeddingService.normalize(zero);
        assertArrayEquals(new float[]{0f, 0f}, zero);
    }

    @Test
    @DisplayName("Missing model folder is a configuration error")
    void missingModelFolder() {
        assertThrows(InvalidConfigurationException.class, () -> new OnnxEmbeddingService(new ApplicationConfig()));
    }
}
