package eu.virtualparadox.ragqa.application.config;

import eu.virtualparadox.ragqa.exception.InvalidConfigurationException;
import eu.virtualparadox.ragqa.rag.context.ContextAssembler;
import eu.virtualparadox.ragqa.rag.context.EEmptyContextPolicy;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * All tunables of the ingestion and query pipelines, bound from {@code ragqa.*}.
 * <p>Validated once at startup; an inconsistent combination fails the context with
 * {@link InvalidConfigurationException} instead of failing individual requests later.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "ragqa")
@Getter @Setter
public class ApplicationConfig {

    /** Lucene index directory. When unset the index lives in memory. */
    private Path index;

    /** Root folder of the ONNX models ({@code retriever/model.onnx}, {@code retriever/tokenizer.json}). */
    private Path models;

    private Chunking chunking = new Chunking();
    private Retrieval retrieval = new Retrieval();
    private Context context = new Context();
    private Generation generation = new Generation();
    private Embedding embedding = new Embedding();
    private Timeouts timeouts = new Timeouts();
    private Executors executors = new Executors();
    private Ingest ingest = new Ingest();

    @Getter @Setter
    public static class Chunking {
        /** Characters per chunk. */
        private int size = 1000;
        /** Characters shared between consecutive chunks. */
        private int overlap = 200;
        /** How far back from the cut point the boundary search may look. */
        private int lookback = 100;
    }

    @Getter @Setter
    public static class Retrieval {
        private int topK = 5;
        private double scoreThreshold = 0.5;
        /** The index is asked for {@code topK * candidateMultiplier} candidates before filtering. */
        private int candidateMultiplier = 2;
    }

    @Getter @Setter
    public static class Context {
        private int maxChars = 6000;
        private int maxChunks = 5;
        private EEmptyContextPolicy emptyPolicy = EEmptyContextPolicy.ANSWER_DIRECTLY;
        private String noInformationAnswer =
                "I could not find relevant information in the uploaded documents to answer this question.";
    }

    @Getter @Setter
    public static class Generation {
        private double temperature = 0.7;
        private int maxTokens = 1024;
    }

    @Getter @Setter
    public static class Embedding {
        private int batchSize = 32;
        private int maxTokens = 512;
        /** ONNX intra-op threads; {@code 0} leaves one core free. */
        private int intraOpThreads = 0;
    }

    @Getter @Setter
    public static class Timeouts {
        /** Embedding a question. */
        private Duration embedding = Duration.ofSeconds(30);
        /** Embedding all chunks of one uploaded document in a single batch. */
        private Duration ingestionEmbedding = Duration.ofMinutes(15);
        private Duration retrieval = Duration.ofSeconds(10);
        private Duration generation = Duration.ofSeconds(120);
    }

    @Getter @Setter
    public static class Executors {
        private int questionThreads = 4;
        private int ingestionThreads = 1;
        private int gatewayThreads = 8;
    }

    @Getter @Setter
    public static class Ingest {
        private DataSize maxFileSize = DataSize.ofMegabytes(10);
    }

    @PostConstruct
    public void validateAndEnsureFolders() throws IOException {
        validate();
        if (index != null) Files.createDirectories(index);
        if (models != null) Files.createDirectories(models);
    }

    /**
     * Checks cross-field constraints.
     *
     * @throws InvalidConfigurationException on the first violated constraint
     */
    public void validate() {
        if (chunking.size <= 0) {
            throw new InvalidConfigurationException("ragqa.chunking.size must be positive");
        }
        if (chunking.overlap < 0 || chunking.overlap >= chunking.size) {
            throw new InvalidConfigurationException(
                    "ragqa.chunking.overlap must be non-negative and less than ragqa.chunking.size");
        }
        if (chunking.lookback <= 0) {
            throw new InvalidConfigurationException("ragqa.chunking.lookback must be positive");
        }
        if (retrieval.topK <= 0) {
            throw new InvalidConfigurationException("ragqa.retrieval.top-k must be positive");
        }
        if (retrieval.candidateMultiplier < 1) {
            throw new InvalidConfigurationException("ragqa.retrieval.candidate-multiplier must be at least 1");
        }
        if (context.maxChunks <= 0) {
            throw new InvalidConfigurationException("ragqa.context.max-chunks must be positive");
        }
        // the best match with its document header must always fit, chunks are never cut
        if (context.maxChars < chunking.size + ContextAssembler.MAX_HEADER_LENGTH) {
            throw new InvalidConfigurationException("ragqa.context.max-chars must be at least ragqa.chunking.size + "
                    + ContextAssembler.MAX_HEADER_LENGTH + " (document header)");
        }
        if (context.emptyPolicy == null) {
            throw new InvalidConfigurationException("ragqa.context.empty-policy must be set");
        }
        if (embedding.batchSize <= 0) {
            throw new InvalidConfigurationException("ragqa.embedding.batch-size must be positive");
        }
        requirePositive(timeouts.embedding, "ragqa.timeouts.embedding");
        requirePositive(timeouts.ingestionEmbedding, "ragqa.timeouts.ingestion-embedding");
        requirePositive(timeouts.retrieval, "ragqa.timeouts.retrieval");
        requirePositive(timeouts.generation, "ragqa.timeouts.generation");
        if (executors.questionThreads <= 0 || executors.ingestionThreads <= 0 || executors.gatewayThreads <= 0) {
            throw new InvalidConfigurationException("ragqa.executors.* thread counts must be positive");
        }
    }

    private static void requirePositive(final Duration duration, final String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new InvalidConfigurationException(name + " must be a positive duration");
        }
    }
}
