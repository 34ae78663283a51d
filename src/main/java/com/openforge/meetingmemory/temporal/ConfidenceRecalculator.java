package com.openforge.meetingmemory.temporal;

import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.chunk.PastReference;
import com.openforge.meetingmemory.chunk.ReferenceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Final enrichment step: re-derives the confidence of every past reference
 * from the belief it was asserted with.
 *
 *   IMPLICIT, TOPIC_CONTINUATION — general decay from the target's timestamp to the
 *                                  referencing chunk's timestamp; another link on the
 *                                  same chunk to the same target reinforces it.
 *   TEMPORAL_MEETING             — dated decay from the referenced meeting's date.
 *   VERSION_EVOLUTION            — untouched, always 0.95.
 *
 * Always starts from the asserted confidence, so running it twice changes nothing.
 */
@Slf4j
@Component
public class ConfidenceRecalculator {

    /** Share of a corroborating link's asserted confidence added as evidence. */
    static final double CORROBORATION_WEIGHT = 0.2;

    /** @return how many references had their confidence changed */
    public int recalculate(List<MemoryChunk> chunks) {
        int[] changed = {0};
        for (MemoryChunk chunk : chunks) {
            Instant at = chunk.getTimestamp();
            if (at == null) continue;
            List<PastReference> snapshot = List.copyOf(chunk.getReferencesPast());
            chunk.updatePastReferences(ref -> {
                PastReference after = recalculate(ref, snapshot, at);
                if (after.confidence() != ref.confidence()) changed[0]++;
                return after;
            });
        }
        log.debug("[Confidence] Recalculated references on {} chunk(s), {} changed", chunks.size(), changed[0]);
        return changed[0];
    }

    PastReference recalculate(PastReference ref, List<PastReference> siblings, Instant at) {
        return switch (ref.kind()) {
            case VERSION_EVOLUTION -> ref;
            case IMPLICIT -> {
                PastReference.Implicit implicit = (PastReference.Implicit) ref;
                TemporalConfidence belief = TemporalConfidence.assertedAt(
                        implicit.assertedConfidence(), origin(implicit.targetTimestamp(), at), DecayProfile.GENERAL);
                corroborate(belief, ref, siblings, at);
                yield implicit.withConfidence(belief.currentConfidence(at));
            }
            case TOPIC_CONTINUATION -> {
                PastReference.TopicContinuation topic = (PastReference.TopicContinuation) ref;
                TemporalConfidence belief = TemporalConfidence.assertedAt(
                        topic.assertedConfidence(), origin(topic.targetTimestamp(), at), DecayProfile.GENERAL);
                corroborate(belief, ref, siblings, at);
                yield topic.withConfidence(belief.currentConfidence(at));
            }
            case TEMPORAL_MEETING -> {
                PastReference.TemporalMeeting meeting = (PastReference.TemporalMeeting) ref;
                TemporalConfidence belief = TemporalConfidence.assertedAt(
                        meeting.assertedConfidence(), origin(meeting.meetingDate(), at), DecayProfile.DATED);
                yield meeting.withConfidence(belief.currentConfidence(at));
            }
        };
    }

    private void corroborate(TemporalConfidence belief, PastReference ref,
                             List<PastReference> siblings, Instant at) {
        for (PastReference other : siblings) {
            if (other == ref || !other.targetId().equals(ref.targetId())) continue;
            if (other.kind() == ReferenceKind.IMPLICIT || other.kind() == ReferenceKind.TOPIC_CONTINUATION) {
                belief.reinforce(asserted(other) * CORROBORATION_WEIGHT, at);
            }
        }
    }

    private static double asserted(PastReference ref) {
        return switch (ref.kind()) {
            case IMPLICIT -> ((PastReference.Implicit) ref).assertedConfidence();
            case TOPIC_CONTINUATION -> ((PastReference.TopicContinuation) ref).assertedConfidence();
            case TEMPORAL_MEETING -> ((PastReference.TemporalMeeting) ref).assertedConfidence();
            case VERSION_EVOLUTION -> ref.confidence();
        };
    }

    private static Instant origin(@Nullable Instant target, Instant at) {
        return target == null ? at : target;
    }
}
