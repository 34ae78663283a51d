package com.openforge.meetingmemory.drift;

import com.openforge.meetingmemory.chunk.DriftRecord;
import com.openforge.meetingmemory.chunk.HistoricalChunk;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.config.TemporalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags topics and entities whose surrounding vocabulary has moved away from
 * how they were used before ("schema" now discussed in "data model" terms).
 *
 * For each term of a chunk:
 *   - take the most recent historical usages (at most {@code maxUsages})
 *   - skip the term when fewer than {@code minUsages} exist
 *   - average the word-set overlap of the chunk's context with each usage's context
 *   - below {@code overlapThreshold}, record drift on the chunk
 *
 * Drift is recorded as chunk metadata; {@code topicsDiscussed} is never touched.
 */
@Slf4j
@Service
public class SemanticDriftDetector {

    private final TemporalProperties.Drift settings;

    public SemanticDriftDetector(TemporalProperties properties) {
        this.settings = properties.drift();
    }

    public List<DriftRecord> detect(MemoryChunk chunk, TermUsageIndex index) {
        List<DriftRecord> drifts = new ArrayList<>();
        String context = chunk.getScoringContext();

        for (String term : chunk.getTerms()) {
            List<HistoricalChunk> usages = index.usages(term, chunk.getTimestamp());
            if (usages.size() < settings.minUsages()) continue;

            List<HistoricalChunk> recent = usages.subList(0, Math.min(settings.maxUsages(), usages.size()));
            double overlap = recent.stream()
                    .mapToDouble(h -> index.words().jaccard(context, h.scoringContext()))
                    .average()
                    .orElse(1.0);
            if (overlap >= settings.overlapThreshold()) continue;

            DriftRecord drift = new DriftRecord(term, overlap, recent.size(), replacementFor(term, chunk, index));
            chunk.addDrift(drift);
            drifts.add(drift);
            log.debug("[Drift] {} term '{}' overlap {} over {} usage(s), replacement={}",
                    chunk.getChunkId(), term, "%.3f".formatted(overlap), recent.size(), drift.replacementTerm());
        }
        return drifts;
    }

    /**
     * Best-effort equivalent: the first other term of the chunk that was never used
     * before, i.e. vocabulary that appeared alongside the drift.
     */
    @Nullable
    private String replacementFor(String term, MemoryChunk chunk, TermUsageIndex index) {
        for (String candidate : chunk.getTerms()) {
            if (candidate.equalsIgnoreCase(term)) continue;
            if (index.usages(candidate, chunk.getTimestamp()).isEmpty()) return candidate;
        }
        return null;
    }
}
