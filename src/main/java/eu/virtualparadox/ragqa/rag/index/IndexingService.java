package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.application.executor.GatewayExecutor;
import eu.virtualparadox.ragqa.exception.EPipelinePhase;
import eu.virtualparadox.ragqa.exception.EmbeddingUnavailableException;
import eu.virtualparadox.ragqa.exception.IngestionFailedException;
import eu.virtualparadox.ragqa.ingest.chunker.Chunker;
import eu.virtualparadox.ragqa.ingest.model.Chunk;
import eu.virtualparadox.ragqa.ingest.model.ChunkMetadata;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingService;
import eu.virtualparadox.ragqa.rag.index.model.IngestionReport;
import eu.virtualparadox.ragqa.util.DurationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Orchestrates the indexing pipeline for one document:
 * <ol>
 *     <li>Segment the extracted text into overlapping chunks</li>
 *     <li>Embed all chunks with a single {@link EmbeddingService#embed(List)} call</li>
 *     <li>Replace the document's chunks in the vector index with one upsert</li>
 * </ol>
 * <p>
 * Nothing touches the index before embedding succeeded, and the upsert itself is atomic, so a
 * failed ingestion leaves the previously indexed state of the document untouched.
 */
@Service
@Slf4j
public class IndexingService {

    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final GatewayExecutor gatewayExecutor;
    private final Duration embeddingTimeout;

    public IndexingService(final Chunker chunker,
                           final EmbeddingService embeddingService,
                           final VectorIndexService vectorIndexService,
                           final GatewayExecutor gatewayExecutor,
                           final ApplicationConfig config) {
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.vectorIndexService = vectorIndexService;
        this.gatewayExecutor = gatewayExecutor;
        this.embeddingTimeout = config.getTimeouts().getIngestionEmbedding();
    }

    /**
     * Indexes (or re-indexes) a document.
     *
     * @param documentId document identifier; existing chunks under this id are replaced
     * @param text       extracted plain text
     * @param metadata   document-level metadata copied into every chunk
     * @return what was indexed
     * @throws IngestionFailedException if any stage fails
     */
    public IngestionReport index(final String documentId,
                                 final String text,
                                 final Map<String, String> metadata) {
        final StopWatch stopWatch = new StopWatch(documentId);

        stopWatch.start("segment");
        final List<Chunk> chunks;
        try {
            chunks = chunker.segment(documentId, text, metadata);
        } catch (final IllegalArgumentException e) {
            throw new IngestionFailedException(documentId, EPipelinePhase.SEGMENTING, e.getMessage(), e);
        }
        stopWatch.stop();
        if (chunks.isEmpty()) {
            throw new IngestionFailedException(documentId, EPipelinePhase.SEGMENTING, "No text content found", null);
        }

        stopWatch.start("embed");
        final List<float[]> vectors;
        try {
            vectors = gatewayExecutor.callWithin(embeddingTimeout,
                    () -> embeddingService.embed(chunks),
                    e -> new EmbeddingUnavailableException(e instanceof TimeoutException
                            ? "Embedding " + chunks.size() + " chunks timed out after " + embeddingTimeout.toSeconds() + " s"
                            : "Embedding " + chunks.size() + " chunks failed", e));
        } catch (final EmbeddingUnavailableException e) {
            throw new IngestionFailedException(documentId, EPipelinePhase.EMBEDDING, e.getMessage(), e);
        }
        stopWatch.stop();
        if (vectors == null || vectors.size() != chunks.size()) {
            throw new IngestionFailedException(documentId, EPipelinePhase.EMBEDDING,
                    "Embedding returned " + (vectors == null ? 0 : vectors.size()) + " vectors for " + chunks.size() + " chunks",
                    null);
        }

        // local Lucene writes are not interrupted, an interrupted IndexWriter closes itself
        stopWatch.start("index");
        try {
            vectorIndexService.upsert(documentId, chunks, vectors);
        } catch (final Exception e) {
            throw new IngestionFailedException(documentId, EPipelinePhase.INDEXING, "Index update failed", e);
        }
        stopWatch.stop();

        log.debug(stopWatch.prettyPrint());
        return new IngestionReport(documentId,
                metadata.getOrDefault(ChunkMetadata.FILENAME, documentId),
                chunks.size(),
                DurationUtils.toMillis(stopWatch.getTotalTimeNanos()));
    }
}
