package com.openforge.meetingmemory.chunk;

import lombok.Builder;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Raw chunk fields as handed over by the extraction collaborator for one
 * transcript segment. Nothing here is validated beyond the defaults applied
 * when the draft becomes a {@link MemoryChunk}.
 *
 * @param offset time into the meeting at which the statement was made, if known
 */
@Builder
public record ChunkDraft(
        @Nullable String          speaker,
        @Nullable List<String>    addressedTo,
        @Nullable InteractionType interactionType,
        @Nullable MemoryType      memoryType,
        @Nullable String          content,
        @Nullable String          fullContext,
        @Nullable List<String>    temporalMarkers,
        @Nullable List<String>    topicsDiscussed,
        @Nullable List<String>    entitiesMentioned,
        @Nullable VersionInfo     versionInfo,
        @Nullable StructuredData  structuredData,
        @Nullable List<FutureLink> createsFuture,
        @Nullable Double          importanceScore,
        @Nullable Double          confidence,
        @Nullable Duration        offset
) {}
