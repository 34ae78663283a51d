package com.openforge.meetingmemory.enrich;

import com.openforge.meetingmemory.chunk.DriftRecord;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.reference.ImplicitReference;
import com.openforge.meetingmemory.version.VersionChain;

import java.util.List;

/**
 * The enriched batch plus what each step contributed.
 */
public record EnrichmentResult(
        List<MemoryChunk>       chunks,
        int                     resolvedReferences,
        List<ImplicitReference> openReferences,
        int                     temporalLinks,
        int                     topicLinks,
        List<DriftRecord>       drifts,
        List<VersionChain>      versionChains
) {

    public int versionLinks() {
        return versionChains.stream().mapToInt(VersionChain::links).sum();
    }
}
