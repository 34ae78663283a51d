package com.openforge.meetingmemory.chunk;

import java.time.Instant;
import java.util.List;

/**
 * Everything known from earlier meetings, oldest first.
 *
 * Supplied fresh with every enrichment call and never mutated by the engine.
 */
public record HistoricalContext(List<HistoricalMeeting> meetings) {

    public HistoricalContext {
        meetings = meetings == null ? List.of() : List.copyOf(meetings);
    }

    public static HistoricalContext empty() {
        return new HistoricalContext(List.of());
    }

    public static HistoricalContext of(HistoricalMeeting... meetings) {
        return new HistoricalContext(List.of(meetings));
    }

    public List<HistoricalChunk> allChunks() {
        return meetings.stream().flatMap(m -> m.chunks().stream()).toList();
    }

    /** Meetings dated inside {@code [from, to]}, both ends inclusive. */
    public List<HistoricalMeeting> meetingsBetween(Instant from, Instant to) {
        return meetings.stream()
                .filter(m -> m.date() != null && !m.date().isBefore(from) && !m.date().isAfter(to))
                .toList();
    }

    public boolean isEmpty() {
        return meetings.stream().allMatch(m -> m.chunks().isEmpty());
    }
}
