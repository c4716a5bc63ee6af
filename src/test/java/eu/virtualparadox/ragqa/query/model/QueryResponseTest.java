package eu.virtualparadox.ragqa.query.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.ragqa.ingest.model.Chunk;
import eu.virtualparadox.ragqa.ingest.model.ChunkMetadata;
import eu.virtualparadox.ragqa.query.QueryResult;
import eu.virtualparadox.ragqa.query.QueryTiming;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static RetrievedMatch match(String text, float score) {
        Chunk chunk = new Chunk("doc_abc", "doc_abc_chunk_3", 3, text, 0, text.length(),
                Map.of(ChunkMetadata.FILENAME, "report.pdf", ChunkMetadata.FILE_TYPE, "pdf"));
        return new RetrievedMatch(chunk, score);
    }

    @Test
    @DisplayName("Serialized response uses snake_case keys and the documented shape")
    void jsonShape() throws Exception {
        QueryResult result = new QueryResult("The answer.",
                List.of(match("short text", 0.876543f)),
                new QueryTiming(1.5, 12.25, 300.75, 320.0));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(QueryResponse.from(result)));

        assertEquals("The answer.", json.get("answer").asText());
        JsonNode source = json.get("sources").get(0);
        assertEquals("short text", source.get("chunk_text").asText());
        assertEquals("doc_abc", source.get("document_id").asText());
        assertEquals(0.8765, source.get("similarity_score").asDouble(), 1e-9);
        assertEquals("report.pdf", source.get("metadata").get("filename").asText());
        assertEquals(3, source.get("metadata").get("chunk_index").asInt());
        assertEquals(2, source.get("metadata").size());

        JsonNode metadata = json.get("metadata");
        assertEquals(12.25, metadata.get("retrieval_time_ms").asDouble());
        assertEquals(300.75, metadata.get("generation_time_ms").asDouble());
        assertEquals(320.0, metadata.get("total_time_ms").asDouble());
        assertEquals(1, metadata.get("chunks_retrieved").asInt());
    }

    @Test
    @DisplayName("Long chunk text is cut to 500 characters plus an ellipsis")
    void longTextTruncated() {
        ChunkSource source = ChunkSource.from(match("a".repeat(800), 0.5f));
        assertEquals("a".repeat(500) + "...", source.chunkText());

        ChunkSource exact = ChunkSource.from(match("b".repeat(500), 0.5f));
        assertEquals("b".repeat(500), exact.chunkText());
    }
}
