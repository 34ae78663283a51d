package com.openforge.meetingmemory.chunk;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

/**
 * A term whose surrounding vocabulary moved away from how it was used before.
 *
 * @param term             the topic or entity that drifted
 * @param averageOverlap   mean word-set overlap with the historical usages (0.0 – 1.0)
 * @param historicalUsages how many historical usages were compared
 * @param replacementTerm  a term that seems to have taken over the meaning, if one was found
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DriftRecord(
        String term,
        double averageOverlap,
        int    historicalUsages,
        @Nullable String replacementTerm
) {}
