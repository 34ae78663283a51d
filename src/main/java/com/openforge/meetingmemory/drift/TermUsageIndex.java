package com.openforge.meetingmemory.drift;

import com.openforge.meetingmemory.chunk.HistoricalChunk;
import com.openforge.meetingmemory.chunk.HistoricalContext;
import com.openforge.meetingmemory.text.WordSetCache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Where each term was used in earlier meetings, for one enrichment call.
 *
 * A historical chunk uses a term when the term is one of its topics or entities,
 * or appears in its content (as a word for single-word terms, as a substring for
 * phrases). Lookups are memoized per term for the lifetime of the index.
 */
public final class TermUsageIndex {

    private final List<HistoricalChunk> recentFirst;
    private final Map<String, List<HistoricalChunk>> usagesByTerm = new HashMap<>();
    private final WordSetCache words = new WordSetCache();

    private TermUsageIndex(List<HistoricalChunk> recentFirst) {
        this.recentFirst = recentFirst;
    }

    public static TermUsageIndex build(HistoricalContext context) {
        List<HistoricalChunk> all = new ArrayList<>(context.allChunks());
        all.sort(Comparator.comparing(HistoricalChunk::timestamp,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return new TermUsageIndex(List.copyOf(all));
    }

    /** Usages of {@code term} not later than {@code notAfter}, most recent first. */
    public List<HistoricalChunk> usages(String term, Instant notAfter) {
        List<HistoricalChunk> all = usagesByTerm.computeIfAbsent(term.toLowerCase(Locale.ROOT), this::scan);
        if (notAfter == null) return all;
        return all.stream()
                .filter(h -> h.timestamp() == null || !h.timestamp().isAfter(notAfter))
                .toList();
    }

    public WordSetCache words() {
        return words;
    }

    private List<HistoricalChunk> scan(String term) {
        boolean phrase = term.contains(" ");
        return recentFirst.stream()
                .filter(h -> tagged(h, term)
                        || (phrase ? h.content().toLowerCase(Locale.ROOT).contains(term)
                                   : words.words(h.content()).contains(term)))
                .toList();
    }

    private static boolean tagged(HistoricalChunk h, String term) {
        return h.topics().stream().anyMatch(term::equalsIgnoreCase)
                || h.entities().stream().anyMatch(term::equalsIgnoreCase);
    }
}
