package com.openforge.meetingmemory.chunk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classifies what kind of fact a memory chunk captures.
 *
 * DECISION    — "What we chose": "We'll ship the v2 schema on Friday."
 * ACTION      — "What someone will do": "Priya to update the deck."
 * TOPIC       — "What was talked about" with no outcome attached.
 * QUESTION    — An open ask that may or may not get answered later.
 * COMMITMENT  — A promise with an owner, usually with a due date.
 * REFERENCE   — A pointer back to an earlier meeting or artifact.
 * RISK        — A concern or blocker raised by a participant.
 * TEMPORAL    — A date, deadline or schedule statement.
 * REQUEST     — Someone asking someone else for something.
 * TECHNICAL   — Specifications, schemas, data models, code.
 */
public enum MemoryType {
    DECISION,
    ACTION,
    TOPIC,
    QUESTION,
    COMMITMENT,
    REFERENCE,
    RISK,
    TEMPORAL,
    REQUEST,
    TECHNICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Best guess when the extraction collaborator left the memory type out. */
    public static MemoryType inferFrom(InteractionType interactionType) {
        return switch (interactionType) {
            case DECISION -> DECISION;
            case COMMITMENT -> COMMITMENT;
            case REQUEST -> REQUEST;
            case QUESTION -> QUESTION;
            case UPDATE -> TEMPORAL;
            case EXPLANATION -> TECHNICAL;
            case ANSWER, DISCUSSION -> TOPIC;
        };
    }
}
