package com.openforge.meetingmemory.query;

import com.openforge.meetingmemory.chunk.MemoryChunk;

import java.util.List;

/**
 * Retrieval collaborator (vector similarity, graph traversal, or both).
 *
 * Results only need a chunk id, timestamp, content and importance score. May
 * return duplicates of chunks already in the context; the orchestrator
 * de-duplicates.
 */
public interface ChunkRetriever {

    List<MemoryChunk> retrieve(QueryPlan plan);

    /**
     * Asked when the current context is still too thin.
     *
     * @param context   unique chunks gathered so far, in retrieval order
     * @param iteration 1-based enrichment round
     */
    List<MemoryChunk> retrieveMore(QueryPlan plan, List<MemoryChunk> context, int iteration);
}
