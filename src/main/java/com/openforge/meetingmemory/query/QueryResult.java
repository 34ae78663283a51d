package com.openforge.meetingmemory.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openforge.meetingmemory.chunk.MemoryChunk;

import java.util.List;

/**
 * Ranked, de-duplicated chunks for one query, ready for answer generation.
 *
 * @param results    unique chunks, importance descending, retrieval order on ties
 * @param iterations additional retrieval rounds performed (0 – max)
 */
public record QueryResult(
        QueryType         queryType,
        List<MemoryChunk> results,
        int               iterations,
        @JsonIgnore QueryPlan plan
) {}
