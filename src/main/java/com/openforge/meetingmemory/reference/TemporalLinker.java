package com.openforge.meetingmemory.reference;

import com.openforge.meetingmemory.chunk.HistoricalChunk;
import com.openforge.meetingmemory.chunk.HistoricalContext;
import com.openforge.meetingmemory.chunk.HistoricalMeeting;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.chunk.PastReference;
import com.openforge.meetingmemory.chunk.ReferenceKind;
import com.openforge.meetingmemory.config.TemporalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Links that need no phrase resolution:
 *
 *   temporal markers — "last week", "yesterday", "last month" point at every
 *                      earlier meeting dated inside that range
 *   topics           — a topic already tagged on earlier chunks continues them
 *
 * Both read the historical context only, never sibling chunks of the batch.
 */
@Slf4j
@Component
public class TemporalLinker {

    private final TemporalProperties.Reference settings;
    private final Map<String, Duration>        ranges = new LinkedHashMap<>();

    public TemporalLinker(TemporalProperties properties) {
        this.settings = properties.reference();
        ranges.put("yesterday",  Duration.ofDays(1));
        ranges.put("last week",  Duration.ofDays(settings.lastWeekDays()));
        ranges.put("last month", Duration.ofDays(30));
    }

    /** @return number of meeting links added */
    public int linkTemporalMarkers(MemoryChunk chunk, HistoricalContext history) {
        Instant at = chunk.getTimestamp();
        if (at == null || chunk.getTemporalMarkers().isEmpty()) return 0;

        int added = 0;
        for (String marker : chunk.getTemporalMarkers()) {
            Duration lookBack = lookBack(marker);
            if (lookBack == null) continue;
            for (HistoricalMeeting meeting : history.meetingsBetween(at.minus(lookBack), at)) {
                if (Objects.equals(meeting.meetingId(), chunk.getMeetingId()) || linked(chunk, meeting.meetingId())) {
                    continue;
                }
                double confidence = settings.temporalMarkerConfidence();
                chunk.addPastReference(new PastReference.TemporalMeeting(
                        marker, meeting.meetingId(), meeting.date(), confidence, confidence));
                added++;
            }
        }
        if (added > 0) {
            log.debug("[Linker] {} linked to {} earlier meeting(s) by temporal markers", chunk.getChunkId(), added);
        }
        return added;
    }

    /** @return number of topic-continuation links added */
    public int linkTopics(MemoryChunk chunk, HistoricalIndex index) {
        if (settings.topicContinuationLimit() == 0) return 0;
        Instant at = chunk.getTimestamp();
        int added = 0;
        for (String topic : chunk.getTopicsDiscussed()) {
            List<HistoricalChunk> related = index.recentFirst().stream()
                    .filter(h -> h.topics().stream().anyMatch(topic::equalsIgnoreCase))
                    .filter(h -> at == null || h.timestamp() == null || !h.timestamp().isAfter(at))
                    .limit(settings.topicContinuationLimit())
                    .toList();
            for (HistoricalChunk h : related) {
                if (continues(chunk, topic, h.chunkId())) continue;
                double confidence = settings.topicContinuationConfidence();
                chunk.addPastReference(new PastReference.TopicContinuation(
                        topic, h.chunkId(), h.timestamp(), confidence, confidence));
                added++;
            }
        }
        return added;
    }

    /** How far back a marker reaches, or null when it names no relative range. */
    Duration lookBack(String marker) {
        String lower = marker.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Duration> e : ranges.entrySet()) {
            if (lower.contains(e.getKey())) return e.getValue();
        }
        return null;
    }

    private static boolean continues(MemoryChunk chunk, String topic, String targetChunkId) {
        return chunk.getReferencesPast().stream()
                .filter(r -> r.kind() == ReferenceKind.TOPIC_CONTINUATION)
                .map(r -> (PastReference.TopicContinuation) r)
                .anyMatch(r -> r.targetChunkId().equals(targetChunkId) && r.topic().equalsIgnoreCase(topic));
    }

    private static boolean linked(MemoryChunk chunk, String meetingId) {
        return chunk.getReferencesPast().stream()
                .filter(r -> r.kind() == ReferenceKind.TEMPORAL_MEETING)
                .anyMatch(r -> r.targetId().equals(meetingId));
    }
}
