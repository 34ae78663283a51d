package com.openforge.meetingmemory.version;

import com.openforge.meetingmemory.chunk.MemoryChunk;

import java.util.List;

/**
 * One artifact's chunks in version order. Derived on every build and never
 * persisted; only the links it leaves on the chunks survive.
 *
 * @param artifact normalized artifact name
 * @param chunks   chunks sorted by version label
 * @param links    adjacent pairs actually linked (pairs that would point forward in time are skipped)
 */
public record VersionChain(String artifact, List<MemoryChunk> chunks, int links) {

    public List<String> versions() {
        return chunks.stream().map(c -> c.getVersionInfo().version()).toList();
    }
}
