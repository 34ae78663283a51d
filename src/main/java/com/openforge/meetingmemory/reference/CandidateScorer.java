package com.openforge.meetingmemory.reference;

import com.openforge.meetingmemory.chunk.HistoricalChunk;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.text.WordSetCache;

import java.time.Duration;

/**
 * Composite score of how likely a historical chunk is the target of an implicit
 * reference:
 *
 *   0.5 · jaccard(context words, candidate words)
 * + 0.3 · e^(−0.01 · |hours between|)
 * + 0.2 · [same speaker]
 *
 * Without a timestamp on either side the temporal term is dropped and the other
 * two weights are scaled up to sum to 1.
 */
public final class CandidateScorer {

    static final double LEXICAL_WEIGHT  = 0.5;
    static final double TEMPORAL_WEIGHT = 0.3;
    static final double SPEAKER_WEIGHT  = 0.2;
    static final double HOURLY_DECAY    = 0.01;

    private CandidateScorer() {
    }

    public static double score(ImplicitReference ref, MemoryChunk chunk,
                               HistoricalChunk candidate, WordSetCache words) {
        double lexical = words.jaccard(ref.contextWindow(), candidate.content());
        double speaker = sameSpeaker(chunk, candidate) ? 1.0 : 0.0;

        if (chunk.getTimestamp() == null || candidate.timestamp() == null) {
            return (LEXICAL_WEIGHT * lexical + SPEAKER_WEIGHT * speaker) / (LEXICAL_WEIGHT + SPEAKER_WEIGHT);
        }
        double hours = Math.abs(Duration.between(candidate.timestamp(), chunk.getTimestamp()).toMinutes()) / 60.0;
        double temporal = Math.exp(-HOURLY_DECAY * hours);
        return LEXICAL_WEIGHT * lexical + TEMPORAL_WEIGHT * temporal + SPEAKER_WEIGHT * speaker;
    }

    private static boolean sameSpeaker(MemoryChunk chunk, HistoricalChunk candidate) {
        return candidate.speaker() != null && candidate.speaker().equalsIgnoreCase(chunk.getSpeaker());
    }
}
