package eu.virtualparadox.ragqa.ingest.model;

/**
 * Keys of {@link Chunk#metadata()}.
 */
public final class ChunkMetadata {

    public static final String FILENAME = "filename";
    public static final String FILE_TYPE = "file_type";
    public static final String UPLOAD_TIMESTAMP = "upload_timestamp";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String TOTAL_CHUNKS = "total_chunks";
    public static final String START_OFFSET = "start_offset";
    public static final String END_OFFSET = "end_offset";

    private ChunkMetadata() {
        // prevent instantiation
    }
}
