package eu.virtualparadox.ragqa.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_SEQUENCE = "sequence";
    public static final String FIELD_START_OFFSET = "startOffset";
    public static final String FIELD_END_OFFSET = "endOffset";
    /** Stored-only chunk metadata entries are written as {@code meta.<key>}. */
    public static final String FIELD_METADATA_PREFIX = "meta.";

    private LuceneConstants() {
        // prevent instantiation
    }
}
