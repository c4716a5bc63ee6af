package eu.virtualparadox.ragqa.ingest.lifecycle;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.application.executor.GatewayExecutor;
import eu.virtualparadox.ragqa.application.executor.IngestionExecutor;
import eu.virtualparadox.ragqa.exception.EPipelinePhase;
import eu.virtualparadox.ragqa.exception.IngestionFailedException;
import eu.virtualparadox.ragqa.ingest.chunker.Chunker;
import eu.virtualparadox.ragqa.ingest.extractor.PdfBoxTextExtractor;
import eu.virtualparadox.ragqa.rag.index.IndexingService;
import eu.virtualparadox.ragqa.rag.index.model.IndexedDocument;
import eu.virtualparadox.ragqa.rag.index.model.IngestionReport;
import eu.virtualparadox.ragqa.testsupport.HashingEmbeddingService;
import eu.virtualparadox.ragqa.testsupport.InMemoryIndex;
import eu.virtualparadox.ragqa.testsupport.TestExecutors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DocumentLifecycleManagerTest {

    private InMemoryIndex index;
    private GatewayExecutor gateway;
    private IngestionExecutor ingestion;
    private ApplicationConfig config;
    private DocumentLifecycleManager manager;

    @BeforeEach
    void setUp() throws IOException {
        index = new InMemoryIndex();
        gateway = TestExecutors.gateway();
        ingestion = TestExecutors.ingestion();
        config = new ApplicationConfig();

        IndexingService indexing = new IndexingService(new Chunker(config), new HashingEmbeddingService(),
                index.service(), gateway, config);
        manager = new DocumentLifecycleManager(new PdfBoxTextExtractor(), indexing, index.service(), ingestion, config);
    }

    @AfterEach
    void tearDown() throws IOException {
        ingestion.shutdown();
        gateway.shutdown();
        index.close();
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("A text upload is indexed under a generated id with file metadata")
    void ingestText() throws IOException {
        IngestionReport report = manager.ingest("notes.txt", utf8("Lucene stores vectors in an HNSW graph."));

        assertTrue(report.documentId().matches("doc_[0-9a-f]{12}"), report.documentId());
        assertEquals("notes.txt", report.filename());
        assertEquals(1, report.chunksProcessed());

        List<IndexedDocument> documents = manager.listAll();
        assertEquals(1, documents.size());
        IndexedDocument document = documents.get(0);
        assertEquals(report.documentId(), document.documentId());
        assertEquals("notes.txt", document.filename());
        assertEquals("txt", document.fileType());
        assertFalse(document.uploadTimestamp().isEmpty());
        assertEquals(1, manager.stats().totalVectors());
    }

    @Test
    @DisplayName("Unsupported, overlong-named, empty, blank and oversized uploads are rejected before indexing")
    void rejectedUploads() throws IOException {
        IngestionFailedException unsupported = assertThrows(IngestionFailedException.class,
                () -> manager.ingest("image.png", utf8("not text")));
        assertEquals(EPipelinePhase.EXTRACTING, unsupported.getPhase());

        assertThrows(IngestionFailedException.class, () -> manager.ingest("empty.txt", new byte[0]));

        IngestionFailedException blank = assertThrows(IngestionFailedException.class,
                () -> manager.ingest("blank.txt", utf8("   \n ")));
        assertEquals("No text content found", blank.getMessage());

        IngestionFailedException longName = assertThrows(IngestionFailedException.class,
                () -> manager.ingest("n".repeat(300) + ".txt", utf8("text")));
        assertEquals(EPipelinePhase.EXTRACTING, longName.getPhase());

        config.getIngest().setMaxFileSize(DataSize.ofBytes(10));
        IngestionFailedException tooLarge = assertThrows(IngestionFailedException.class,
                () -> manager.ingest("big.txt", utf8("more than ten bytes of text")));
        assertTrue(tooLarge.getMessage().contains("exceeds limit"));

        assertEquals(0, manager.stats().totalVectors());
    }

    @Test
    @DisplayName("Corrupt PDFs fail in the extracting phase")
    void corruptPdf() {
        IngestionFailedException e = assertThrows(IngestionFailedException.class,
                () -> manager.ingest("broken.pdf", utf8("%PDF-garbage")));
        assertEquals(EPipelinePhase.EXTRACTING, e.getPhase());
    }

    @Test
    @DisplayName("Asynchronous ingestion completes on the ingestion executor")
    void ingestAsync() throws Exception {
        IngestionReport report = manager.ingestAsync("async.txt", utf8("Processed in the background."))
                .get(10, TimeUnit.SECONDS);

        assertEquals("async.txt", report.filename());
        assertEquals(1, manager.listAll().size());
    }

    @Test
    @DisplayName("Asynchronous extraction failures complete the future exceptionally")
    void ingestAsyncFailure() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> manager.ingestAsync("blank.txt", utf8("   ")).get(10, TimeUnit.SECONDS));
        assertInstanceOf(IngestionFailedException.class, e.getCause());
    }

    @Test
    @DisplayName("Documents can be deleted one by one or all at once")
    void delete() throws IOException {
        IngestionReport first = manager.ingest("one.txt", utf8("First document."));
        manager.ingest("two.txt", utf8("Second document."));

        assertEquals(1, manager.deleteDocument(first.documentId()));
        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> manager.deleteDocument(first.documentId()));
        assertEquals("Document not found: " + first.documentId(), missing.getMessage());
        assertEquals(1, manager.listAll().size());

        manager.deleteAll();
        assertTrue(manager.listAll().isEmpty());
    }
}
