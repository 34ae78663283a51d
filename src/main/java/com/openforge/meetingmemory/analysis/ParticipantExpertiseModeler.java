package com.openforge.meetingmemory.analysis;

import com.openforge.meetingmemory.chunk.FutureLink;
import com.openforge.meetingmemory.chunk.InteractionType;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.chunk.MemoryType;
import com.openforge.meetingmemory.chunk.PastReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Speaker × topic expertise from substantive contributions (explanations,
 * answers, decisions).
 *
 * Contribution quality is the mean of four factors:
 *   length          min(chars / 500, 1)
 *   structured data 2.0 if present, else 1.0
 *   decision        1.5 if the chunk is a decision or creates one, else 1.0
 *   referenced      0.5 × number of later chunks referencing it
 *
 * Each contribution is weighted by {@code 1 / (1 + 0.01 · ageDays)} and summed
 * per speaker and topic; every speaker's scores are then scaled so their top
 * topic is 1.0 (three decimals).
 */
@Slf4j
@Component
public class ParticipantExpertiseModeler {

    static final double LENGTH_SATURATION   = 500.0;
    static final double RECENCY_DECAY       = 0.01;

    public Map<String, Map<String, Double>> model(List<MemoryChunk> chunks, Instant now) {
        Map<String, Integer> referenceCounts = referenceCounts(chunks);
        Map<String, Map<String, Double>> raw = new LinkedHashMap<>();

        for (MemoryChunk chunk : chunks) {
            if (!chunk.getInteractionType().isSubstantive() || chunk.getTopicsDiscussed().isEmpty()) continue;

            double quality = contributionQuality(chunk, referenceCounts.getOrDefault(chunk.getChunkId(), 0));
            double weight  = quality * recencyFactor(chunk.getTimestamp(), now);
            Map<String, Double> topics = raw.computeIfAbsent(chunk.getSpeaker(), s -> new LinkedHashMap<>());
            for (String topic : chunk.getTopicsDiscussed()) {
                topics.merge(topic, weight, Double::sum);
            }
        }

        Map<String, Map<String, Double>> normalized = normalize(raw);
        log.debug("[Expertise] Modeled {} speaker(s) from {} chunk(s)", normalized.size(), chunks.size());
        return normalized;
    }

    static double contributionQuality(MemoryChunk chunk, int timesReferenced) {
        double length     = Math.min(chunk.getContent().length() / LENGTH_SATURATION, 1.0);
        double structured = chunk.getStructuredData() != null ? 2.0 : 1.0;
        double decision   = leadsToDecision(chunk) ? 1.5 : 1.0;
        double referenced = timesReferenced * 0.5;
        return (length + structured + decision + referenced) / 4.0;
    }

    static double recencyFactor(Instant timestamp, Instant now) {
        if (timestamp == null) return 1.0;
        long ageDays = Math.max(0, Duration.between(timestamp, now).toDays());
        return 1.0 / (1.0 + RECENCY_DECAY * ageDays);
    }

    private static boolean leadsToDecision(MemoryChunk chunk) {
        return chunk.getMemoryType() == MemoryType.DECISION
                || chunk.getInteractionType() == InteractionType.DECISION
                || chunk.getCreatesFuture().stream().anyMatch(f -> f.kind() == FutureLink.Kind.DECISION);
    }

    private static Map<String, Integer> referenceCounts(List<MemoryChunk> chunks) {
        Map<String, Integer> counts = new HashMap<>();
        for (MemoryChunk chunk : chunks) {
            for (PastReference ref : chunk.getReferencesPast()) {
                if (ref.targetId() != null) counts.merge(ref.targetId(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static Map<String, Map<String, Double>> normalize(Map<String, Map<String, Double>> raw) {
        Map<String, Map<String, Double>> normalized = new LinkedHashMap<>();
        raw.forEach((speaker, topics) -> {
            double max = topics.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            Map<String, Double> scaled = new LinkedHashMap<>();
            topics.forEach((topic, score) ->
                    scaled.put(topic, max > 0 ? Math.round(score / max * 1000.0) / 1000.0 : 0.0));
            normalized.put(speaker, scaled);
        });
        return normalized;
    }
}
