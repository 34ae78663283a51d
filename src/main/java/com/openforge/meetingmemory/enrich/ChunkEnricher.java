package com.openforge.meetingmemory.enrich;

import com.openforge.meetingmemory.chunk.DriftRecord;
import com.openforge.meetingmemory.chunk.HistoricalContext;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.drift.SemanticDriftDetector;
import com.openforge.meetingmemory.drift.TermUsageIndex;
import com.openforge.meetingmemory.reference.HistoricalIndex;
import com.openforge.meetingmemory.reference.ImplicitReference;
import com.openforge.meetingmemory.reference.ReferenceResolver;
import com.openforge.meetingmemory.reference.ResolutionReport;
import com.openforge.meetingmemory.reference.TemporalLinker;
import com.openforge.meetingmemory.temporal.ConfidenceRecalculator;
import com.openforge.meetingmemory.version.VersionChain;
import com.openforge.meetingmemory.version.VersionChainBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the enrichment steps over one freshly extracted batch, in a fixed order:
 *
 *   a. RESOLVE   — implicit references, temporal markers and topic continuations,
 *                  against historical context only
 *   b. DRIFT     — semantic drift per term, against historical context only
 *   c. VERSIONS  — version chains over the whole batch, so same-meeting updates link
 *   d. CONFIDENCE— recalculated last, once the link set is final
 *
 * Historical indexes are built once per call and thrown away with it; the
 * history itself is never modified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkEnricher {

    private final ReferenceResolver      referenceResolver;
    private final TemporalLinker         temporalLinker;
    private final SemanticDriftDetector  driftDetector;
    private final VersionChainBuilder    versionChainBuilder;
    private final ConfidenceRecalculator confidenceRecalculator;

    public EnrichmentResult enrich(List<MemoryChunk> batch, HistoricalContext history) {
        HistoricalIndex referenceIndex = HistoricalIndex.build(history);
        TermUsageIndex  usageIndex     = TermUsageIndex.build(history);

        // a. references
        int resolved = 0, temporalLinks = 0, topicLinks = 0;
        List<ImplicitReference> open = new ArrayList<>();
        for (MemoryChunk chunk : batch) {
            ResolutionReport report = referenceResolver.resolve(chunk, referenceIndex);
            resolved += report.resolved().size();
            open.addAll(report.unresolved());
            temporalLinks += temporalLinker.linkTemporalMarkers(chunk, history);
            topicLinks    += temporalLinker.linkTopics(chunk, referenceIndex);
        }

        // b. drift
        List<DriftRecord> drifts = new ArrayList<>();
        for (MemoryChunk chunk : batch) {
            drifts.addAll(driftDetector.detect(chunk, usageIndex));
        }

        // c. versions
        List<VersionChain> chains = versionChainBuilder.build(batch);

        // d. confidence
        confidenceRecalculator.recalculate(batch);

        EnrichmentResult result = new EnrichmentResult(List.copyOf(batch), resolved, List.copyOf(open),
                temporalLinks, topicLinks, List.copyOf(drifts), List.copyOf(chains));
        log.info("[Enricher] {} chunk(s) against {} historical chunk(s): resolved={} open={} temporal={} topic={} drift={} versionLinks={}",
                batch.size(), referenceIndex.size(), resolved, open.size(), temporalLinks, topicLinks,
                drifts.size(), result.versionLinks());
        return result;
    }
}
