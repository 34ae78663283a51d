package com.openforge.meetingmemory.query;

import com.openforge.meetingmemory.chunk.MemoryChunk;

import java.util.List;

public record AnsweredQuery(
        String            query,
        QueryType         queryType,
        String            answer,
        List<MemoryChunk> sources,
        int               iterations
) {}
