package com.openforge.meetingmemory.reference;

/**
 * What an implicit reference points at; selects which historical index the
 * candidates come from.
 */
public enum ReferenceType {
    TEMPORAL,
    PERSON,
    ARTIFACT,
    DECISION
}
