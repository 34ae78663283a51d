package com.openforge.meetingmemory.version;

import com.openforge.meetingmemory.chunk.FutureLink;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.chunk.PastReference;
import com.openforge.meetingmemory.chunk.ReferenceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links chunks that describe successive versions of the same artifact.
 *
 * Grouping is by exact artifact name after trim + lower-case. Within a group the
 * version labels are compared as plain strings ("v10" sorts before "v2"); no
 * semantic-version parsing is attempted. The sort is stable, so equal labels
 * keep their batch order.
 *
 * Chains are rebuilt from scratch: existing version-evolution links on the
 * batch are dropped first, which makes repeated builds on the same batch
 * produce identical links.
 */
@Slf4j
@Component
public class VersionChainBuilder {

    static final Comparator<MemoryChunk> BY_VERSION_LABEL =
            Comparator.comparing((MemoryChunk c) -> c.getVersionInfo().version());

    public List<VersionChain> build(List<MemoryChunk> batch) {
        Map<String, List<MemoryChunk>> byArtifact = new LinkedHashMap<>();
        for (MemoryChunk chunk : batch) {
            chunk.removeFutureLinks(FutureLink.Kind.VERSION_EVOLUTION);
            chunk.removePastReferences(ReferenceKind.VERSION_EVOLUTION);
            if (chunk.getVersionInfo() != null) {
                byArtifact.computeIfAbsent(chunk.getVersionInfo().normalizedArtifact(), k -> new ArrayList<>())
                        .add(chunk);
            }
        }

        List<VersionChain> chains = new ArrayList<>();
        for (Map.Entry<String, List<MemoryChunk>> e : byArtifact.entrySet()) {
            List<MemoryChunk> sorted = new ArrayList<>(e.getValue());
            sorted.sort(BY_VERSION_LABEL);
            int links = 0;
            for (int i = 0; i < sorted.size() - 1; i++) {
                if (link(sorted.get(i), sorted.get(i + 1))) links++;
            }
            chains.add(new VersionChain(e.getKey(), List.copyOf(sorted), links));
            log.debug("[VersionChain] '{}' {} -> {} link(s)", e.getKey(),
                    sorted.stream().map(c -> c.getVersionInfo().version()).toList(), links);
        }
        return chains;
    }

    private boolean link(MemoryChunk current, MemoryChunk next) {
        if (current.getTimestamp() != null && next.getTimestamp() != null
                && current.getTimestamp().isAfter(next.getTimestamp())) {
            log.warn("[VersionChain] Skipping {} -> {}: version {} was recorded after {}",
                    current.getChunkId(), next.getChunkId(),
                    current.getVersionInfo().version(), next.getVersionInfo().version());
            return false;
        }
        current.addFutureLink(FutureLink.evolvesTo(next.getVersionInfo().version(), next.getChunkId()));
        next.addPastReference(PastReference.VersionEvolution.previous(
                current.getVersionInfo().version(), current.getChunkId()));
        return true;
    }
}
