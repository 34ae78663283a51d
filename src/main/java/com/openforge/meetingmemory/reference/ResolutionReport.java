package com.openforge.meetingmemory.reference;

import com.openforge.meetingmemory.chunk.PastReference;

import java.util.List;

/**
 * Outcome of resolving the implicit references of one chunk.
 *
 * @param resolved   links appended to the chunk
 * @param unresolved phrases with no candidate or no candidate above the score threshold
 */
public record ResolutionReport(
        List<PastReference.Implicit> resolved,
        List<ImplicitReference>      unresolved
) {

    public static ResolutionReport empty() {
        return new ResolutionReport(List.of(), List.of());
    }
}
