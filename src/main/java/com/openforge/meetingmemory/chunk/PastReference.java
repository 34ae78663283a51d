package com.openforge.meetingmemory.chunk;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A link from a chunk back to something said earlier.
 *
 * Each kind carries only the fields that make sense for it. {@code confidence}
 * is the current belief; {@code assertedConfidence} is the belief at the moment
 * the link was created and is what temporal recalculation decays from, so
 * recalculating twice gives the same answer.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PastReference.Implicit.class,          name = "implicit"),
        @JsonSubTypes.Type(value = PastReference.VersionEvolution.class,  name = "version_evolution"),
        @JsonSubTypes.Type(value = PastReference.TopicContinuation.class, name = "topic_continuation"),
        @JsonSubTypes.Type(value = PastReference.TemporalMeeting.class,   name = "temporal_reference")
})
public sealed interface PastReference {

    /** Version-evolution links come from explicit metadata and always carry this confidence. */
    double VERSION_EVOLUTION_CONFIDENCE = 0.95;

    @JsonIgnore
    ReferenceKind kind();

    /** Id of the chunk (or meeting, for {@link TemporalMeeting}) this reference points at. */
    @JsonIgnore
    String targetId();

    double confidence();

    PastReference withConfidence(double confidence);

    // ── Kinds ────────────────────────────────────────────────────────────────

    record Implicit(
            String reference,
            String resolvedTo,
            @Nullable Instant targetTimestamp,
            double assertedConfidence,
            double confidence
    ) implements PastReference {

        public Implicit {
            assertedConfidence = Scores.clampConfidence(assertedConfidence);
            confidence         = Scores.clampConfidence(confidence);
        }

        public static Implicit resolved(String phrase, String targetId,
                                        @Nullable Instant targetTimestamp, double score) {
            return new Implicit(phrase, targetId, targetTimestamp, score, score);
        }

        @Override public ReferenceKind kind()     { return ReferenceKind.IMPLICIT; }
        @Override public String        targetId() { return resolvedTo; }

        @Override
        public Implicit withConfidence(double value) {
            return new Implicit(reference, resolvedTo, targetTimestamp, assertedConfidence, value);
        }
    }

    record VersionEvolution(
            String reference,
            String targetChunkId,
            double confidence
    ) implements PastReference {

        public VersionEvolution {
            confidence = Scores.clampConfidence(confidence);
        }

        public static VersionEvolution previous(String previousVersion, String targetChunkId) {
            return new VersionEvolution("Previous version " + previousVersion,
                    targetChunkId, VERSION_EVOLUTION_CONFIDENCE);
        }

        @Override public ReferenceKind kind()     { return ReferenceKind.VERSION_EVOLUTION; }
        @Override public String        targetId() { return targetChunkId; }

        @Override
        public VersionEvolution withConfidence(double value) {
            return new VersionEvolution(reference, targetChunkId, value);
        }
    }

    record TopicContinuation(
            String topic,
            String targetChunkId,
            @Nullable Instant targetTimestamp,
            double assertedConfidence,
            double confidence
    ) implements PastReference {

        public TopicContinuation {
            assertedConfidence = Scores.clampConfidence(assertedConfidence);
            confidence         = Scores.clampConfidence(confidence);
        }

        @Override public ReferenceKind kind()     { return ReferenceKind.TOPIC_CONTINUATION; }
        @Override public String        targetId() { return targetChunkId; }

        @Override
        public TopicContinuation withConfidence(double value) {
            return new TopicContinuation(topic, targetChunkId, targetTimestamp, assertedConfidence, value);
        }
    }

    record TemporalMeeting(
            String  marker,
            String  meetingId,
            Instant meetingDate,
            double  assertedConfidence,
            double  confidence
    ) implements PastReference {

        public TemporalMeeting {
            assertedConfidence = Scores.clampConfidence(assertedConfidence);
            confidence         = Scores.clampConfidence(confidence);
        }

        @Override public ReferenceKind kind()     { return ReferenceKind.TEMPORAL_MEETING; }
        @Override public String        targetId() { return meetingId; }

        @Override
        public TemporalMeeting withConfidence(double value) {
            return new TemporalMeeting(marker, meetingId, meetingDate, assertedConfidence, value);
        }
    }
}
