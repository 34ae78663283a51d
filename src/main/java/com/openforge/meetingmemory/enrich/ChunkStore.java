package com.openforge.meetingmemory.enrich;

import com.openforge.meetingmemory.chunk.MemoryChunk;

import java.util.List;

/**
 * Storage collaborator: persists a fully enriched batch (vector and graph
 * stores in production). Not retried by the engine.
 */
public interface ChunkStore {

    void store(List<MemoryChunk> chunks);
}
