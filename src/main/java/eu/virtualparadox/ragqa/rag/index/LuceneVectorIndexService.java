package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.ingest.model.Chunk;
import eu.virtualparadox.ragqa.ingest.model.ChunkMetadata;
import eu.virtualparadox.ragqa.rag.index.model.IndexStats;
import eu.virtualparadox.ragqa.rag.index.model.IndexedDocument;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static eu.virtualparadox.ragqa.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 * <p>
 * This index writes chunk text and dense vectors into a single Lucene index:
 * <ul>
 *   <li>Each chunk is stored as one Lucene {@link Document}</li>
 *   <li>Text content and metadata are stored for context assembly and citations</li>
 *   <li>Vectors are written via {@link KnnFloatVectorField} with cosine similarity</li>
 * </ul>
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code docId} – {@link StringField}, stored: document identifier for grouping/deletion</li>
 *   <li>{@code chunkId} – {@link StringField}, stored: unique chunk identifier</li>
 *   <li>{@code text} – {@link StoredField}: full chunk text</li>
 *   <li>{@code sequence}, {@code startOffset}, {@code endOffset} – {@link StoredField}: chunk position</li>
 *   <li>{@code meta.*} – {@link StoredField}: chunk metadata entries</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField}: dense float vector (HNSW indexed)</li>
 * </ul>
 *
 * <h3>Scores</h3>
 * Lucene reports cosine matches as {@code (1 + cos) / 2}; {@link #query(float[], int)} maps them back
 * to the raw cosine in {@code [-1, 1]} so score thresholds keep their usual meaning.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class LuceneVectorIndexService implements VectorIndexService {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * Dimension of the vectors in this index, {@code 0} until known.
     * <p>
     * Lucene enforces a single dimension per vector field name across the entire index.
     * We cache the first-seen dimension and validate subsequent inserts.
     */
    private final AtomicInteger vectorDim = new AtomicInteger();

    /**
     * Adds or replaces all chunks for a given document.
     * <p>
     * Old and new chunks are swapped with a single {@link IndexWriter#updateDocuments} call on the
     * {@code docId} term, which Lucene applies atomically, then committed and made searchable.
     * A failure before or during the swap leaves the previous state of the document in place.
     *
     * @param docId   parent document identifier
     * @param chunks  chunk metadata (size must match {@code vectors})
     * @param vectors dense vectors, one per chunk (all same dimension)
     * @throws IOException if writing to the Lucene index fails
     * @throws IllegalArgumentException if input lists are null, empty, or size/dimension mismatch
     */
    @Override
    public void upsert(final String docId,
                       final List<Chunk> chunks,
                       final List<float[]> vectors) throws IOException {

        requireNonNullOrEmpty(docId, "docId");
        requireNonNullOrEmpty(chunks, "chunks");
        requireNonNullOrEmpty(vectors, "vectors");

        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("chunks.size() != vectors.size()");
        }

        // Validate & cache vector dimension
        final int dim = vectors.get(0) == null ? 0 : vectors.get(0).length;
        ensureConsistentDimension(dim);
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
        }

        final List<Document> documents = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            final Chunk c = chunks.get(i);
            if (!docId.equals(c.documentId())) {
                throw new IllegalArgumentException("Chunk " + c.chunkId() + " does not belong to document " + docId);
            }
            documents.add(buildLuceneDocument(c, vectors.get(i)));
        }

        writer.updateDocuments(new Term(FIELD_DOC_ID, docId), documents);
        writer.commit();
        searcherManager.maybeRefreshBlocking();

        log.info("Indexed {} chunks for document {}", documents.size(), docId);
    }

    /**
     * Deletes all chunks associated with the given {@code docId}.
     *
     * @param docId parent document identifier
     * @return number of chunks that were indexed for the document
     * @throws IOException if index update fails
     */
    @Override
    public int deleteByDocId(final String docId) throws IOException {
        requireNonNullOrEmpty(docId, "docId");
        final Term term = new Term(FIELD_DOC_ID, docId);

        final int existing;
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            existing = searcher.count(new TermQuery(term));
        } finally {
            searcherManager.release(searcher);
        }

        writer.deleteDocuments(term);
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        return existing;
    }

    @Override
    public void deleteAll() throws IOException {
        writer.deleteAll();
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        vectorDim.set(0);
    }

    @Override
    public List<RetrievedMatch> query(final float[] vector, final int k) throws IOException {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("vector must not be empty");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, vector, k);
            final TopDocs topDocs = searcher.search(knn, k);
            final StoredFields storedFields = searcher.storedFields();

            final List<RetrievedMatch> results = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                results.add(new RetrievedMatch(toChunk(doc), toCosine(sd.score)));
            }
            return results;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public List<IndexedDocument> listDocuments() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int total = searcher.getIndexReader().numDocs();
            if (total == 0) {
                return List.of();
            }

            final TopDocs all = searcher.search(new MatchAllDocsQuery(), total);
            final StoredFields storedFields = searcher.storedFields();

            final Map<String, Document> firstChunk = new LinkedHashMap<>();
            final Map<String, Integer> chunkCounts = new HashMap<>();
            for (final ScoreDoc sd : all.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                final String docId = doc.get(FIELD_DOC_ID);
                firstChunk.putIfAbsent(docId, doc);
                chunkCounts.merge(docId, 1, Integer::sum);
            }

            final List<IndexedDocument> documents = new ArrayList<>(firstChunk.size());
            for (final Map.Entry<String, Document> entry : firstChunk.entrySet()) {
                final Document doc = entry.getValue();
                documents.add(new IndexedDocument(
                        entry.getKey(),
                        metadataOrDefault(doc, ChunkMetadata.FILENAME, "Unknown"),
                        metadataOrDefault(doc, ChunkMetadata.FILE_TYPE, "unknown"),
                        metadataOrDefault(doc, ChunkMetadata.UPLOAD_TIMESTAMP, ""),
                        chunkCounts.get(entry.getKey())));
            }
            return documents;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public IndexStats stats() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            int dimension = 0;
            for (final LeafReaderContext leaf : searcher.getIndexReader().leaves()) {
                final FieldInfo info = leaf.reader().getFieldInfos().fieldInfo(FIELD_VECTOR);
                if (info != null && info.getVectorDimension() > 0) {
                    dimension = info.getVectorDimension();
                    break;
                }
            }
            return new IndexStats(searcher.getIndexReader().numDocs(), dimension);
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Ensures an internal, stable notion of the vector dimension.
     *
     * @param dim proposed dimension
     * @throws IllegalArgumentException if a different dimension has already been established
     */
    private void ensureConsistentDimension(final int dim) throws IOException {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim.get() == 0) {
            // pick up the dimension of an index opened from disk
            final int existing = stats().dimension();
            vectorDim.compareAndSet(0, existing > 0 ? existing : dim);
        }
        final int established = vectorDim.get();
        if (established != dim) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + established + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    /**
     * Builds a Lucene {@link Document} for a single chunk+vector pair.
     *
     * @param c   chunk payload
     * @param vec dense float vector
     * @return a fully populated Lucene document
     */
    private Document buildLuceneDocument(final Chunk c, final float[] vec) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_DOC_ID, c.documentId(), Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_ID, c.chunkId(), Field.Store.YES));

        // Text content and position (stored only)
        d.add(new StoredField(FIELD_TEXT, c.text()));
        d.add(new StoredField(FIELD_SEQUENCE, c.sequenceIndex()));
        d.add(new StoredField(FIELD_START_OFFSET, c.startOffset()));
        d.add(new StoredField(FIELD_END_OFFSET, c.endOffset()));

        for (final Map.Entry<String, String> entry : c.metadata().entrySet()) {
            d.add(new StoredField(FIELD_METADATA_PREFIX + entry.getKey(), entry.getValue()));
        }

        // Vector for HNSW ANN search
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));

        return d;
    }

    private Chunk toChunk(final Document doc) {
        final Map<String, String> metadata = new HashMap<>();
        for (final IndexableField field : doc.getFields()) {
            if (field.name().startsWith(FIELD_METADATA_PREFIX)) {
                metadata.put(field.name().substring(FIELD_METADATA_PREFIX.length()), field.stringValue());
            }
        }
        return new Chunk(
                doc.get(FIELD_DOC_ID),
                doc.get(FIELD_CHUNK_ID),
                intField(doc, FIELD_SEQUENCE),
                doc.get(FIELD_TEXT),
                intField(doc, FIELD_START_OFFSET),
                intField(doc, FIELD_END_OFFSET),
                metadata);
    }

    private static int intField(final Document doc, final String name) {
        final IndexableField field = doc.getField(name);
        return field == null ? 0 : field.numericValue().intValue();
    }

    private static String metadataOrDefault(final Document doc, final String key, final String fallback) {
        final String value = doc.get(FIELD_METADATA_PREFIX + key);
        return value == null ? fallback : value;
    }

    private static float toCosine(final float luceneScore) {
        return 2f * luceneScore - 1f;
    }

    /**
     * Utility to assert a required string or collection is non-null/non-empty.
     *
     * @param value value to check
     * @param name  parameter name for error messaging
     */
    private void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
