package com.openforge.meetingmemory.query;

import com.openforge.meetingmemory.chunk.MemoryChunk;

import java.util.List;

/**
 * Hand-off to the answer generator. Serialized with the shared snake_case
 * mapper: {@code {"query", "query_type", "ranked_chunks"}}.
 */
public record AnswerRequest(
        String            query,
        QueryType         queryType,
        List<MemoryChunk> rankedChunks
) {

    public AnswerRequest {
        rankedChunks = rankedChunks == null ? List.of() : List.copyOf(rankedChunks);
    }

    static AnswerRequest of(String query, QueryResult result) {
        return new AnswerRequest(query, result.queryType(), result.results());
    }
}
