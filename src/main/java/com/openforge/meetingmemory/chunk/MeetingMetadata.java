package com.openforge.meetingmemory.chunk;

import java.time.Instant;
import java.util.List;

/**
 * The meeting a batch of chunk drafts belongs to.
 */
public record MeetingMetadata(
        String       meetingId,
        Instant      date,
        String       title,
        List<String> participants,
        List<String> topics
) {

    public MeetingMetadata {
        if (meetingId == null || meetingId.isBlank()) {
            throw new IllegalArgumentException("meetingId must not be blank");
        }
        if (date == null) {
            throw new IllegalArgumentException("meeting date is required");
        }
        participants = participants == null ? List.of() : List.copyOf(participants);
        topics       = topics == null ? List.of() : List.copyOf(topics);
    }

    public static MeetingMetadata of(String meetingId, Instant date) {
        return new MeetingMetadata(meetingId, date, meetingId, List.of(), List.of());
    }
}
