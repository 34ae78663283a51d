package com.openforge.meetingmemory.chunk;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a chunk from an earlier meeting.
 *
 * Only {@code chunkId}, {@code content} and {@code confidence} are guaranteed;
 * the timestamp and the classification fields may be missing when the history
 * was loaded from a thin source.
 */
@Builder
public record HistoricalChunk(
        String chunkId,
        @Nullable Instant timestamp,
        String content,
        double confidence,
        @Nullable String          fullContext,
        @Nullable String          speaker,
        @Nullable InteractionType interactionType,
        @Nullable MemoryType      memoryType,
        @Nullable String          artifact,
        List<String> topics,
        List<String> entities
) {

    public HistoricalChunk {
        if (chunkId == null || chunkId.isBlank()) {
            throw new IllegalArgumentException("historical chunk requires an id");
        }
        content    = content == null ? "" : content;
        confidence = Scores.clampConfidence(confidence);
        topics     = topics == null ? List.of() : List.copyOf(topics);
        entities   = entities == null ? List.of() : List.copyOf(entities);
    }

    public static HistoricalChunk of(String chunkId, @Nullable Instant timestamp, String content, double confidence) {
        return new HistoricalChunk(chunkId, timestamp, content, confidence,
                null, null, null, null, null, List.of(), List.of());
    }

    /** Snapshot of an already enriched chunk, for feeding it back in as history. */
    public static HistoricalChunk from(MemoryChunk chunk) {
        return new HistoricalChunk(
                chunk.getChunkId(),
                chunk.getTimestamp(),
                chunk.getContent(),
                chunk.getConfidence(),
                chunk.getFullContext(),
                chunk.getSpeaker(),
                chunk.getInteractionType(),
                chunk.getMemoryType(),
                chunk.getVersionInfo() == null ? null : chunk.getVersionInfo().artifact(),
                chunk.getTopicsDiscussed(),
                chunk.getEntitiesMentioned());
    }

    /** Context for overlap scoring: the surrounding text when present, else the content. */
    public String scoringContext() {
        return fullContext == null || fullContext.isBlank() ? content : fullContext;
    }

    /**
     * True when nothing but the guaranteed fields is known. Such chunks cannot be
     * routed to a specific reference index.
     */
    public boolean isUnclassified() {
        return speaker == null && interactionType == null && memoryType == null && artifact == null;
    }
}
