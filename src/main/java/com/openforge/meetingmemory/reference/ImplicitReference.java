package com.openforge.meetingmemory.reference;

/**
 * A vague phrase found in a chunk, before resolution. Never persisted.
 *
 * @param text          the matched phrase as it appears ("the original design")
 * @param keyword       the captured noun used to find candidates ("design")
 * @param type          which kind of earlier statement the phrase points at
 * @param contextWindow text whose words are compared against each candidate
 */
public record ImplicitReference(
        String        text,
        String        keyword,
        ReferenceType type,
        String        contextWindow
) {}
