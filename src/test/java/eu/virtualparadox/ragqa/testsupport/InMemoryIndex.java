package eu.virtualparadox.ragqa.testsupport;

import eu.virtualparadox.ragqa.rag.index.LuceneVectorIndexService;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;

import java.io.IOException;

/**
 * Lucene vector index held in memory, wired the same way the application wires the on-disk one.
 */
public final class InMemoryIndex implements AutoCloseable {

    private final ByteBuffersDirectory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final LuceneVectorIndexService service;

    public InMemoryIndex() throws IOException {
        this.directory = new ByteBuffersDirectory();
        this.writer = new IndexWriter(directory, new IndexWriterConfig());
        this.searcherManager = new SearcherManager(writer, null);
        this.service = new LuceneVectorIndexService(writer, searcherManager);
    }

    public LuceneVectorIndexService service() {
        return service;
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }
}
