package com.openforge.meetingmemory.reference;

import com.openforge.meetingmemory.chunk.HistoricalChunk;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.chunk.PastReference;
import com.openforge.meetingmemory.chunk.ReferenceKind;
import com.openforge.meetingmemory.config.TemporalProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps vague phrases in a chunk ("the original design", "as Priya mentioned")
 * to the most probable earlier chunk.
 *
 * Per phrase:
 *   1. DETECT   — {@link ReferencePattern} over the chunk content
 *   2. POOL     — candidates from the type's historical pool that mention the keyword,
 *                 never later than the chunk, at most N most recent
 *   3. SCORE    — {@link CandidateScorer}
 *   4. SELECT   — best score; ties go to the most recent, then the smallest id
 *   5. ACCEPT   — only at or above the minimum score; otherwise left unresolved.
 *                 The link is asserted at score × the candidate's own confidence,
 *                 so it never outranks the fact it points at.
 *
 * Phrases are resolved independently, even when several share a type.
 */
@Slf4j
@Service
public class ReferenceResolver {

    static final Comparator<ScoredCandidate> BEST_FIRST = Comparator
            .comparingDouble(ScoredCandidate::score).reversed()
            .thenComparing((ScoredCandidate s) -> s.candidate().timestamp(),
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing((ScoredCandidate s) -> s.candidate().chunkId());

    private final TemporalProperties.Reference settings;

    public ReferenceResolver(TemporalProperties properties) {
        this.settings = properties.reference();
    }

    public record ScoredCandidate(HistoricalChunk candidate, double score) {}

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Resolves every implicit reference in {@code chunk} and appends the accepted
     * links to its {@code referencesPast}.
     */
    public ResolutionReport resolve(MemoryChunk chunk, HistoricalIndex index) {
        List<ImplicitReference> phrases = ReferencePattern.detect(chunk.getContent());
        if (phrases.isEmpty()) return ResolutionReport.empty();

        List<PastReference.Implicit> resolved   = new ArrayList<>();
        List<ImplicitReference>      unresolved = new ArrayList<>();

        for (ImplicitReference phrase : phrases) {
            Optional<ScoredCandidate> best = bestCandidate(phrase, chunk, index);
            if (best.isEmpty() || best.get().score() < settings.minScore()) {
                log.debug("[Resolver] {} left open for '{}' (best score {})", chunk.getChunkId(), phrase.text(),
                        best.map(s -> "%.3f".formatted(s.score())).orElse("n/a"));
                unresolved.add(phrase);
                if (settings.recordOpenReferences()) chunk.addUnresolvedReference(phrase.text());
                continue;
            }
            ScoredCandidate winner = best.get();
            PastReference.Implicit link = PastReference.Implicit.resolved(
                    phrase.text(), winner.candidate().chunkId(), winner.candidate().timestamp(),
                    winner.score() * winner.candidate().confidence());
            if (!alreadyLinked(chunk, link)) {
                chunk.addPastReference(link);
            }
            resolved.add(link);
            log.debug("[Resolver] {} '{}' -> {} (score {})", chunk.getChunkId(), phrase.text(),
                    link.resolvedTo(), "%.3f".formatted(winner.score()));
        }
        return new ResolutionReport(List.copyOf(resolved), List.copyOf(unresolved));
    }

    /** Highest-scoring admissible candidate for one phrase, if the pool is not empty. */
    public Optional<ScoredCandidate> bestCandidate(ImplicitReference phrase, MemoryChunk chunk, HistoricalIndex index) {
        return candidates(phrase, chunk, index).stream()
                .map(c -> new ScoredCandidate(c, CandidateScorer.score(phrase, chunk, c, index.words())))
                .min(BEST_FIRST);
    }

    /** The bounded candidate pool for a phrase, most recent first. */
    public List<HistoricalChunk> candidates(ImplicitReference phrase, MemoryChunk chunk, HistoricalIndex index) {
        Instant at = chunk.getTimestamp();
        return index.pool(phrase.type()).stream()
                .filter(c -> mentions(c, phrase))
                .filter(c -> notLaterThan(c, at))
                .filter(c -> withinWindow(c, at))
                .limit(settings.maxCandidatesPerType())
                .toList();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static boolean mentions(HistoricalChunk candidate, ImplicitReference phrase) {
        String keyword = phrase.keyword();
        if (candidate.content().toLowerCase(Locale.ROOT).contains(keyword)) return true;
        if (phrase.type() != ReferenceType.PERSON) return false;
        return keyword.equalsIgnoreCase(candidate.speaker())
                || candidate.entities().stream().anyMatch(keyword::equalsIgnoreCase);
    }

    /** No forward-in-time resolution, whatever the window policy says. */
    private static boolean notLaterThan(HistoricalChunk candidate, Instant at) {
        return at == null || candidate.timestamp() == null || !candidate.timestamp().isAfter(at);
    }

    private boolean withinWindow(HistoricalChunk candidate, Instant at) {
        if (!settings.enforceWindow() || at == null || candidate.timestamp() == null) return true;
        return !candidate.timestamp().isBefore(at.minus(Duration.ofHours(settings.windowHours())));
    }

    private static boolean alreadyLinked(MemoryChunk chunk, PastReference.Implicit link) {
        return chunk.getReferencesPast().stream()
                .filter(r -> r.kind() == ReferenceKind.IMPLICIT)
                .map(r -> (PastReference.Implicit) r)
                .anyMatch(r -> r.reference().equalsIgnoreCase(link.reference())
                        && r.resolvedTo().equals(link.resolvedTo()));
    }
}
