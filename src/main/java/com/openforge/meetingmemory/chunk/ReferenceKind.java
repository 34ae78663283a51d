package com.openforge.meetingmemory.chunk;

/**
 * Discriminator for {@link PastReference}. Switch on this rather than on the
 * concrete record class so a new kind breaks every consumer at compile time.
 */
public enum ReferenceKind {

    /** A vague phrase ("the original design") resolved to an earlier chunk by scoring. */
    IMPLICIT,

    /** Backward edge of a version chain, derived from explicit version metadata. */
    VERSION_EVOLUTION,

    /** An earlier chunk tagged with the same topic. */
    TOPIC_CONTINUATION,

    /** A dated temporal marker ("last week") pointing at a whole earlier meeting. */
    TEMPORAL_MEETING
}
