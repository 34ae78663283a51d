package com.openforge.meetingmemory.chunk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a statement functions in the conversation, independent of what it is about.
 */
public enum InteractionType {
    REQUEST,
    QUESTION,
    ANSWER,
    DECISION,
    COMMITMENT,
    UPDATE,
    EXPLANATION,
    DISCUSSION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Statements that show a participant knows the subject, used by expertise modeling. */
    public boolean isSubstantive() {
        return switch (this) {
            case EXPLANATION, ANSWER, DECISION -> true;
            case REQUEST, QUESTION, COMMITMENT, UPDATE, DISCUSSION -> false;
        };
    }
}
