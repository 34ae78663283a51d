package com.openforge.meetingmemory.enrich;

/**
 * What one meeting ingestion produced.
 */
public record IngestionSummary(
        String meetingId,
        int    chunkCount,
        int    resolvedReferences,
        int    openReferences,
        int    driftCount,
        int    versionLinks
) {

    static IngestionSummary of(String meetingId, EnrichmentResult result) {
        return new IngestionSummary(
                meetingId,
                result.chunks().size(),
                result.resolvedReferences(),
                result.openReferences().size(),
                result.drifts().size(),
                result.versionLinks());
    }
}
