package com.openforge.meetingmemory.analysis;

/**
 * A question nobody has answered back to the asker yet.
 */
public record UnresolvedThread(
        String chunkId,
        String question,
        String askedBy,
        String askedIn,
        double importance,
        long   daysUnresolved
) {}
