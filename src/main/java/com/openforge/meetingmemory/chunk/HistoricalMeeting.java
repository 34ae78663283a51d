package com.openforge.meetingmemory.chunk;

import java.time.Instant;
import java.util.List;

/**
 * An earlier meeting with the chunks extracted from it.
 */
public record HistoricalMeeting(
        String                meetingId,
        Instant               date,
        List<String>          topics,
        List<HistoricalChunk> chunks
) {

    public HistoricalMeeting {
        topics = topics == null ? List.of() : List.copyOf(topics);
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }
}
