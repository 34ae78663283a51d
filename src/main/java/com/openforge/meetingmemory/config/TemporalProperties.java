package com.openforge.meetingmemory.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning knobs for the temporal linking and retrieval engine.
 *
 * application.yml:
 *
 * meeting:
 *   temporal:
 *     reference:
 *       min-score: 0.7
 *       window-hours: 168
 *       enforce-window: false
 *       max-candidates-per-type: 5
 *       record-open-references: false
 *       topic-continuation-limit: 3
 *       topic-continuation-confidence: 0.7
 *       last-week-days: 7
 *       temporal-marker-confidence: 0.8
 *     drift:
 *       max-usages: 5
 *       min-usages: 3
 *       overlap-threshold: 0.3
 *     query:
 *       max-enrich-iterations: 3
 *       sufficient-chunks: 5
 *     draft:
 *       default-importance: 5.0
 *       default-confidence: 0.8
 */
@Validated
@ConfigurationProperties(prefix = "meeting.temporal")
public record TemporalProperties(
        @Valid @DefaultValue Reference reference,
        @Valid @DefaultValue Drift     drift,
        @Valid @DefaultValue Query     query,
        @Valid @DefaultValue Draft     draft
) {

    /**
     * @param minScore             composite score below which a reference stays unresolved
     * @param windowHours          temporal-proximity window for candidates
     * @param enforceWindow        when true, candidates older than the window are dropped
     *                             instead of merely scoring lower
     * @param maxCandidatesPerType most recent candidates kept per reference type
     */
    public record Reference(
            @DefaultValue("0.7") @DecimalMin("0.0") @DecimalMax("1.0") double minScore,
            @DefaultValue("168") @Min(1) long windowHours,
            @DefaultValue("false") boolean enforceWindow,
            @DefaultValue("5") @Min(1) int maxCandidatesPerType,
            @DefaultValue("false") boolean recordOpenReferences,
            @DefaultValue("3") @Min(0) int topicContinuationLimit,
            @DefaultValue("0.7") @DecimalMin("0.0") @DecimalMax("1.0") double topicContinuationConfidence,
            @DefaultValue("7") @Min(1) int lastWeekDays,
            @DefaultValue("0.8") @DecimalMin("0.0") @DecimalMax("1.0") double temporalMarkerConfidence
    ) {}

    /**
     * @param maxUsages        most recent historical usages compared per term
     * @param minUsages        fewer usages than this and a term is skipped
     * @param overlapThreshold average overlap below which drift is flagged
     */
    public record Drift(
            @DefaultValue("5") @Min(1) int maxUsages,
            @DefaultValue("3") @Min(1) int minUsages,
            @DefaultValue("0.3") @DecimalMin("0.0") @DecimalMax("1.0") double overlapThreshold
    ) {}

    /**
     * @param maxEnrichIterations hard cap on additional retrieval rounds per query
     * @param sufficientChunks    unique chunks at which the context counts as sufficient
     */
    public record Query(
            @DefaultValue("3") @Min(0) int maxEnrichIterations,
            @DefaultValue("5") @Min(1) int sufficientChunks
    ) {}

    public record Draft(
            @DefaultValue("5.0") @DecimalMin("1.0") @DecimalMax("10.0") double defaultImportance,
            @DefaultValue("0.8") @DecimalMin("0.0") @DecimalMax("1.0") double defaultConfidence
    ) {}

    /** Same values as the annotated defaults, for wiring components by hand. */
    public static TemporalProperties defaults() {
        return new TemporalProperties(
                new Reference(0.7, 168, false, 5, false, 3, 0.7, 7, 0.8),
                new Drift(5, 3, 0.3),
                new Query(3, 5),
                new Draft(5.0, 0.8));
    }

    public TemporalProperties withReference(Reference newReference) {
        return new TemporalProperties(newReference, drift, query, draft);
    }
}
