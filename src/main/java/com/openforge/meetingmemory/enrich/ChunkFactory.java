package com.openforge.meetingmemory.enrich;

import com.openforge.meetingmemory.chunk.ChunkDraft;
import com.openforge.meetingmemory.chunk.MeetingMetadata;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.config.TemporalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns extraction drafts into memory chunks for one meeting.
 *
 *  - ids are {@code <meetingId>_chunk_<n>}, n counting over the whole meeting
 *  - timestamp is the meeting date plus the draft's offset, never earlier than
 *    the previous chunk's
 *  - missing importance / confidence get the configured defaults; everything
 *    else is completed by {@link MemoryChunk}'s own defaults
 */
@Slf4j
@Component
public class ChunkFactory {

    private final TemporalProperties.Draft defaults;

    public ChunkFactory(TemporalProperties properties) {
        this.defaults = properties.draft();
    }

    public List<MemoryChunk> create(MeetingMetadata meeting, List<ChunkDraft> drafts) {
        List<MemoryChunk> chunks = new ArrayList<>(drafts.size());
        Instant previous = meeting.date();
        int completed = 0;

        for (int i = 0; i < drafts.size(); i++) {
            ChunkDraft d = drafts.get(i);
            Instant at = meeting.date().plus(d.offset() == null ? Duration.ZERO : d.offset());
            if (at.isBefore(previous)) at = previous;
            previous = at;

            if (d.importanceScore() == null || d.confidence() == null || d.speaker() == null) completed++;

            chunks.add(MemoryChunk.builder()
                    .chunkId(meeting.meetingId() + "_chunk_" + i)
                    .meetingId(meeting.meetingId())
                    .timestamp(at)
                    .speaker(d.speaker())
                    .addressedTo(d.addressedTo())
                    .interactionType(d.interactionType())
                    .memoryType(d.memoryType())
                    .content(d.content())
                    .fullContext(d.fullContext())
                    .createsFuture(d.createsFuture())
                    .versionInfo(d.versionInfo())
                    .structuredData(d.structuredData())
                    .temporalMarkers(d.temporalMarkers())
                    .topicsDiscussed(d.topicsDiscussed())
                    .entitiesMentioned(d.entitiesMentioned())
                    .importanceScore(d.importanceScore() == null ? defaults.defaultImportance() : d.importanceScore())
                    .confidence(d.confidence() == null ? defaults.defaultConfidence() : d.confidence())
                    .build());
        }
        if (completed > 0) {
            log.debug("[Ingest] Completed {} draft(s) of meeting {} with default values", completed, meeting.meetingId());
        }
        return chunks;
    }
}
