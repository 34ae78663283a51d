package com.openforge.meetingmemory.chunk;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One atomic fact extracted from a meeting transcript.
 *
 * Key design notes:
 *
 *  chunkId          — unique across the corpus and stable once assigned. Other
 *                     chunks and query results refer to a chunk by this id only.
 *
 *  referencesPast   — derived links; only the enrichment pipeline adds or
 *  createsFuture      removes entries, through the mutators below. Getters hand
 *                     out read-only views.
 *
 *  importanceScore  — always inside [1, 10] and [0, 1] respectively; setters and
 *  confidence         the builder clamp rather than reject.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemoryChunk {

    public static final double DEFAULT_IMPORTANCE = 5.0;
    public static final double DEFAULT_CONFIDENCE = 0.8;

    private final String          chunkId;
    private final String          meetingId;
    private final Instant         timestamp;
    private final String          speaker;
    private final List<String>    addressedTo;
    private final InteractionType interactionType;
    private final MemoryType      memoryType;
    private final String          content;
    private final String          fullContext;

    private final List<PastReference> referencesPast;
    private final List<FutureLink>    createsFuture;

    @Nullable private final VersionInfo    versionInfo;
    @Nullable private final StructuredData structuredData;

    private final List<String> temporalMarkers;
    private final List<String> topicsDiscussed;
    private final List<String> entitiesMentioned;

    private double importanceScore;
    private double confidence;

    private final List<DriftRecord> semanticDrift;
    private final List<String>      unresolvedReferences;

    @Builder
    private MemoryChunk(String chunkId,
                        String meetingId,
                        Instant timestamp,
                        String speaker,
                        List<String> addressedTo,
                        InteractionType interactionType,
                        MemoryType memoryType,
                        String content,
                        String fullContext,
                        List<PastReference> referencesPast,
                        List<FutureLink> createsFuture,
                        VersionInfo versionInfo,
                        StructuredData structuredData,
                        List<String> temporalMarkers,
                        List<String> topicsDiscussed,
                        List<String> entitiesMentioned,
                        Double importanceScore,
                        Double confidence) {
        this.chunkId         = Objects.requireNonNull(chunkId, "chunkId");
        this.meetingId       = meetingId;
        this.timestamp       = timestamp;
        this.speaker         = speaker == null || speaker.isBlank() ? "unknown" : speaker.trim();
        this.addressedTo     = cleanList(addressedTo);
        this.interactionType = interactionType == null ? InteractionType.DISCUSSION : interactionType;
        this.memoryType      = memoryType == null ? MemoryType.inferFrom(this.interactionType) : memoryType;
        this.content         = content == null ? "" : content.trim();
        this.fullContext     = fullContext == null ? "" : fullContext.trim();
        this.referencesPast  = referencesPast == null ? new ArrayList<>() : new ArrayList<>(referencesPast);
        this.createsFuture   = createsFuture == null ? new ArrayList<>() : new ArrayList<>(createsFuture);
        this.versionInfo     = versionInfo;
        this.structuredData  = structuredData;
        this.temporalMarkers   = cleanList(temporalMarkers);
        this.topicsDiscussed   = cleanList(topicsDiscussed);
        this.entitiesMentioned = cleanList(entitiesMentioned);
        this.importanceScore = Scores.clampImportance(importanceScore == null ? DEFAULT_IMPORTANCE : importanceScore);
        this.confidence      = Scores.clampConfidence(confidence == null ? DEFAULT_CONFIDENCE : confidence);
        this.semanticDrift        = new ArrayList<>();
        this.unresolvedReferences = new ArrayList<>();
    }

    // ── Read-only views ──────────────────────────────────────────────────────

    public List<String> getAddressedTo()       { return Collections.unmodifiableList(addressedTo); }
    public List<PastReference> getReferencesPast() { return Collections.unmodifiableList(referencesPast); }
    public List<FutureLink> getCreatesFuture() { return Collections.unmodifiableList(createsFuture); }
    public List<String> getTemporalMarkers()   { return Collections.unmodifiableList(temporalMarkers); }
    public List<String> getTopicsDiscussed()   { return Collections.unmodifiableList(topicsDiscussed); }
    public List<String> getEntitiesMentioned() { return Collections.unmodifiableList(entitiesMentioned); }
    public List<DriftRecord> getSemanticDrift() { return Collections.unmodifiableList(semanticDrift); }
    public List<String> getUnresolvedReferences() { return Collections.unmodifiableList(unresolvedReferences); }

    /** Context used for overlap scoring: the surrounding utterances when present, else the content. */
    @JsonIgnore
    public String getScoringContext() {
        return fullContext.isBlank() ? content : fullContext;
    }

    // ── Scores ───────────────────────────────────────────────────────────────

    public void setImportanceScore(double importanceScore) {
        this.importanceScore = Scores.clampImportance(importanceScore);
    }

    public void setConfidence(double confidence) {
        this.confidence = Scores.clampConfidence(confidence);
    }

    // ── Derived-link mutators (enrichment pipeline only) ─────────────────────

    public void addPastReference(PastReference reference) {
        referencesPast.add(Objects.requireNonNull(reference));
    }

    public void removePastReferences(ReferenceKind kind) {
        referencesPast.removeIf(r -> r.kind() == kind);
    }

    public void updatePastReferences(UnaryOperator<PastReference> update) {
        referencesPast.replaceAll(update);
    }

    public void addFutureLink(FutureLink link) {
        createsFuture.add(Objects.requireNonNull(link));
    }

    public void removeFutureLinks(FutureLink.Kind kind) {
        createsFuture.removeIf(l -> l.kind() == kind);
    }

    public void addDrift(DriftRecord drift) {
        semanticDrift.add(Objects.requireNonNull(drift));
    }

    public void addUnresolvedReference(String phrase) {
        unresolvedReferences.add(phrase);
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    /** True when the chunk carries markers, version metadata or dated references. */
    @JsonIgnore
    public boolean isTemporal() {
        return !temporalMarkers.isEmpty()
                || versionInfo != null
                || referencesPast.stream().anyMatch(r -> r.kind() == ReferenceKind.TEMPORAL_MEETING);
    }

    public boolean referencesPerson(String person) {
        if (person == null || person.isBlank()) return false;
        String needle = person.trim().toLowerCase(Locale.ROOT);
        if (speaker.toLowerCase(Locale.ROOT).contains(needle)) return true;
        return addressedTo.stream().anyMatch(n -> n.toLowerCase(Locale.ROOT).contains(needle))
                || entitiesMentioned.stream().anyMatch(n -> n.toLowerCase(Locale.ROOT).contains(needle));
    }

    /** Topics and entities together, de-duplicated case-insensitively, in first-seen order. */
    @JsonIgnore
    public List<String> getTerms() {
        List<String> terms = new ArrayList<>();
        List<String> seen  = new ArrayList<>();
        for (String t : topicsDiscussed)   addTerm(t, terms, seen);
        for (String e : entitiesMentioned) addTerm(e, terms, seen);
        return terms;
    }

    private static void addTerm(String term, List<String> terms, List<String> seen) {
        String key = term.toLowerCase(Locale.ROOT);
        if (!seen.contains(key)) {
            seen.add(key);
            terms.add(term);
        }
    }

    private static List<String> cleanList(List<String> values) {
        List<String> cleaned = new ArrayList<>();
        if (values == null) return cleaned;
        for (String v : values) {
            if (v != null && !v.isBlank()) cleaned.add(v.trim());
        }
        return cleaned;
    }

    @Override
    public String toString() {
        return "MemoryChunk[" + chunkId + " @" + timestamp + " " + speaker + ": " + content + "]";
    }
}
