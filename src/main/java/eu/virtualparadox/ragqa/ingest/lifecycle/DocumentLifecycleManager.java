package eu.virtualparadox.ragqa.ingest.lifecycle;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.application.executor.IngestionExecutor;
import eu.virtualparadox.ragqa.exception.EPipelinePhase;
import eu.virtualparadox.ragqa.exception.IngestionFailedException;
import eu.virtualparadox.ragqa.ingest.extractor.TextExtractor;
import eu.virtualparadox.ragqa.ingest.model.ChunkMetadata;
import eu.virtualparadox.ragqa.ingest.model.EFileType;
import eu.virtualparadox.ragqa.rag.context.ContextAssembler;
import eu.virtualparadox.ragqa.rag.index.IndexingService;
import eu.virtualparadox.ragqa.rag.index.VectorIndexService;
import eu.virtualparadox.ragqa.rag.index.model.IndexStats;
import eu.virtualparadox.ragqa.rag.index.model.IndexedDocument;
import eu.virtualparadox.ragqa.rag.index.model.IngestionReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Manages the lifecycle of uploaded documents in the vector index:
 * <ul>
 *   <li>Validation and text extraction of uploads (PDF, TXT)</li>
 *   <li>Synchronous and asynchronous ingestion</li>
 *   <li>Listing and deletion, per document or all at once</li>
 * </ul>
 * The index is the only store; document listings are rebuilt from chunk metadata.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentLifecycleManager {

    private static final String ERROR_NOT_FOUND = "Document not found: ";

    private final TextExtractor textExtractor;
    private final IndexingService indexingService;
    private final VectorIndexService vectorIndexService;
    private final IngestionExecutor ingestionExecutor;
    private final ApplicationConfig config;

    /**
     * Validates, extracts and indexes an uploaded file on the calling thread.
     *
     * @param filename original file name, decides the file type
     * @param content  file bytes
     * @return what was indexed
     * @throws IngestionFailedException if the file is rejected or any stage fails
     */
    public IngestionReport ingest(final String filename, final byte[] content) {
        final String documentId = generateId();
        final EFileType type = validate(documentId, filename, content);
        return extractAndIndex(documentId, filename, type, content);
    }

    /**
     * Validates the upload on the calling thread, then extracts and indexes it on the ingestion executor.
     *
     * @param filename original file name
     * @param content  file bytes
     * @return future completing with the report, or exceptionally with {@link IngestionFailedException}
     * @throws IngestionFailedException if the file is rejected up front
     */
    public CompletableFuture<IngestionReport> ingestAsync(final String filename, final byte[] content) {
        final String documentId = generateId();
        final EFileType type = validate(documentId, filename, content);

        return CompletableFuture.supplyAsync(() -> {
            log.info("Asynchronous ingestion started for {} ({})", documentId, filename);
            try {
                final IngestionReport report = extractAndIndex(documentId, filename, type, content);
                log.info("Asynchronous ingestion completed for {}", documentId);
                return report;
            } catch (RuntimeException e) {
                log.error("Asynchronous ingestion failed for {}", documentId, e);
                throw e;
            }
        }, ingestionExecutor);
    }

    /**
     * Deletes every chunk of a document from the index.
     *
     * @param id document identifier
     * @return number of chunks removed
     * @throws IllegalArgumentException if no chunk of the document is indexed
     * @throws IOException              if the index update fails
     */
    public int deleteDocument(final String id) throws IOException {
        final int deleted = vectorIndexService.deleteByDocId(id);
        if (deleted == 0) {
            throw new IllegalArgumentException(ERROR_NOT_FOUND + id);
        }
        log.info("Deleted document {} and its {} chunks from the index", id, deleted);
        return deleted;
    }

    public void deleteAll() throws IOException {
        vectorIndexService.deleteAll();
        log.info("Deleted all documents from the index");
    }

    public List<IndexedDocument> listAll() throws IOException {
        return vectorIndexService.listDocuments();
    }

    public IndexStats stats() throws IOException {
        return vectorIndexService.stats();
    }

    private EFileType validate(final String documentId, final String filename, final byte[] content) {
        final EFileType type = EFileType.fromFilename(filename)
                .orElseThrow(() -> new IngestionFailedException(documentId, EPipelinePhase.EXTRACTING,
                        "Unsupported file type: " + filename, null));

        if (filename.length() > ContextAssembler.MAX_FILENAME_LENGTH) {
            throw new IngestionFailedException(documentId, EPipelinePhase.EXTRACTING,
                    "File name longer than " + ContextAssembler.MAX_FILENAME_LENGTH + " characters", null);
        }

        if (content == null || content.length == 0) {
            throw new IngestionFailedException(documentId, EPipelinePhase.EXTRACTING, "File is empty: " + filename, null);
        }

        final long limit = config.getIngest().getMaxFileSize().toBytes();
        if (content.length > limit) {
            throw new IngestionFailedException(documentId, EPipelinePhase.EXTRACTING,
                    String.format("File size (%.2fMB) exceeds limit of %.2fMB",
                            content.length / (1024.0 * 1024.0), limit / (1024.0 * 1024.0)),
                    null);
        }
        return type;
    }

    private IngestionReport extractAndIndex(final String documentId,
                                            final String filename,
                                            final EFileType type,
                                            final byte[] content) {
        final String text;
        try {
            text = textExtractor.extractText(type, content);
        } catch (RuntimeException e) {
            throw new IngestionFailedException(documentId, EPipelinePhase.EXTRACTING, e.getMessage(), e);
        }
        if (text == null || text.isBlank()) {
            throw new IngestionFailedException(documentId, EPipelinePhase.EXTRACTING, "No text content found", null);
        }

        final Map<String, String> metadata = Map.of(
                ChunkMetadata.FILENAME, filename,
                ChunkMetadata.FILE_TYPE, type.id(),
                ChunkMetadata.UPLOAD_TIMESTAMP, Instant.now().toString());

        return indexingService.index(documentId, text, metadata);
    }

    /**
     * Generates a new document identifier: {@code doc_} followed by 12 hex characters.
     */
    private static String generateId() {
        return "doc_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
