package eu.virtualparadox.ragqa.application.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Lucene resources of the vector index.
 * <p>The index only holds keyword ids, stored fields and HNSW vectors, so the writer runs
 * without an analyzer. Spring closes the beans through their {@code close()} methods on shutdown,
 * searcher manager first and directory last.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    /**
     * @param config application properties; {@code ragqa.index} selects the on-disk location
     * @return directory under {@code ragqa.index}, or an in-memory one when unset
     * @throws IOException if the directory cannot be opened
     */
    @Bean
    public Directory vectorIndexDirectory(final ApplicationConfig config) throws IOException {
        final Path location = config.getIndex();
        if (location == null) {
            log.warn("ragqa.index is not set, the vector index is kept in memory only");
            return new ByteBuffersDirectory();
        }
        log.info("Opening vector index at {}", location.toAbsolutePath());
        return FSDirectory.open(location);
    }

    /**
     * Single writer of the index. Every upsert and delete commits through it.
     */
    @Bean
    public IndexWriter vectorIndexWriter(final Directory vectorIndexDirectory) throws IOException {
        final IndexWriterConfig writerConfig = new IndexWriterConfig()
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        return new IndexWriter(vectorIndexDirectory, writerConfig);
    }

    /**
     * Near-real-time searchers over the writer, refreshed after each commit.
     */
    @Bean
    public SearcherManager vectorSearcherManager(final IndexWriter vectorIndexWriter) throws IOException {
        return new SearcherManager(vectorIndexWriter, null);
    }
}
