package eu.virtualparadox.ragqa.ingest.model;

import java.util.Map;

/**
 * Immutable chunk of a document: the unit that is embedded, indexed and retrieved.
 *
 * @param documentId    owning document
 * @param chunkId       unique id, {@code {documentId}_chunk_{sequenceIndex}}
 * @param sequenceIndex 0-based position within the document
 * @param text          stripped chunk text, never empty
 * @param startOffset   inclusive start of the unstripped span in the source text
 * @param endOffset     exclusive end of the unstripped span in the source text
 * @param metadata      auxiliary attributes, see {@link ChunkMetadata}
 */
public record Chunk(String documentId,
                    String chunkId,
                    int sequenceIndex,
                    String text,
                    int startOffset,
                    int endOffset,
                    Map<String, String> metadata) {

    public Chunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Chunk ofSingleText(final String text) {
        return new Chunk("", "", 0, text, 0, text.length(), Map.of());
    }

    public String filename() {
        return metadata.getOrDefault(ChunkMetadata.FILENAME, documentId);
    }
}
