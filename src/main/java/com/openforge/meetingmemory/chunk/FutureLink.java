package com.openforge.meetingmemory.chunk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * Something a chunk sets in motion: an action, a commitment, a follow-up, a
 * decision to be taken, or the next version of an artifact.
 *
 * @param kind          what sort of future item this is; serialized as {@code type}
 * @param description   free text ("Send the revised deck", "Evolves to v3")
 * @param owner         who is on the hook, if anyone
 * @param due           when, as spoken ("next Friday"); not parsed
 * @param targetChunkId for version evolution, the chunk holding the next version
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FutureLink(
        @JsonProperty("type") Kind kind,
        String description,
        @Nullable String owner,
        @Nullable String due,
        @Nullable String targetChunkId
) {

    public enum Kind {
        ACTION,
        COMMITMENT,
        FOLLOW_UP,
        DECISION,
        VERSION_EVOLUTION;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static FutureLink action(String description, @Nullable String owner, @Nullable String due) {
        return new FutureLink(Kind.ACTION, description, owner, due, null);
    }

    public static FutureLink commitment(String description, @Nullable String owner, @Nullable String due) {
        return new FutureLink(Kind.COMMITMENT, description, owner, due, null);
    }

    public static FutureLink decision(String description, @Nullable String owner, @Nullable String due) {
        return new FutureLink(Kind.DECISION, description, owner, due, null);
    }

    public static FutureLink evolvesTo(String nextVersion, String nextChunkId) {
        return new FutureLink(Kind.VERSION_EVOLUTION, "Evolves to " + nextVersion, null, null, nextChunkId);
    }
}
