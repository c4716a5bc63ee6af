package eu.virtualparadox.ragqa.query.model;

import eu.virtualparadox.ragqa.query.QueryResult;

import java.util.List;

/**
 * Answer to a question in the shape exposed to clients, serialized with snake_case keys.
 */
public record QueryResponse(String answer, List<ChunkSource> sources, QueryMetadata metadata) {

    public static QueryResponse from(final QueryResult result) {
        final List<ChunkSource> sources = result.sources().stream()
                .map(ChunkSource::from)
                .toList();
        final QueryMetadata metadata = new QueryMetadata(
                result.timing().retrievalMs(),
                result.timing().generationMs(),
                result.timing().totalMs(),
                sources.size());
        return new QueryResponse(result.answer(), sources, metadata);
    }
}
