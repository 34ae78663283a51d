package com.openforge.meetingmemory.reference;

import com.openforge.meetingmemory.chunk.HistoricalChunk;
import com.openforge.meetingmemory.chunk.HistoricalContext;
import com.openforge.meetingmemory.chunk.InteractionType;
import com.openforge.meetingmemory.chunk.MemoryType;
import com.openforge.meetingmemory.text.WordSetCache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Candidate pools for one enrichment call, split by {@link ReferenceType}.
 *
 * Built from the historical context handed in with the call and discarded
 * afterwards. Each pool is ordered most recent first; chunks without a
 * timestamp go last in their original order.
 *
 * A historical chunk that carries nothing but the guaranteed fields (id,
 * timestamp, content, confidence) cannot be routed and is placed in every pool.
 */
public final class HistoricalIndex {

    static final Comparator<HistoricalChunk> MOST_RECENT_FIRST = Comparator.comparing(
            HistoricalChunk::timestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Map<ReferenceType, List<HistoricalChunk>> pools;
    private final List<HistoricalChunk> recentFirst;
    private final WordSetCache words = new WordSetCache();

    private HistoricalIndex(Map<ReferenceType, List<HistoricalChunk>> pools, List<HistoricalChunk> recentFirst) {
        this.pools       = pools;
        this.recentFirst = recentFirst;
    }

    public static HistoricalIndex build(HistoricalContext context) {
        List<HistoricalChunk> all = new ArrayList<>(context.allChunks());
        all.sort(MOST_RECENT_FIRST);

        Map<ReferenceType, List<HistoricalChunk>> pools = new EnumMap<>(ReferenceType.class);
        for (ReferenceType type : ReferenceType.values()) {
            pools.put(type, new ArrayList<>());
        }
        for (HistoricalChunk chunk : all) {
            for (ReferenceType type : ReferenceType.values()) {
                if (belongsTo(chunk, type)) pools.get(type).add(chunk);
            }
        }
        return new HistoricalIndex(pools, List.copyOf(all));
    }

    static boolean belongsTo(HistoricalChunk chunk, ReferenceType type) {
        if (chunk.isUnclassified()) return true;
        return switch (type) {
            case TEMPORAL -> chunk.timestamp() != null;
            case PERSON -> chunk.speaker() != null || !chunk.entities().isEmpty();
            case ARTIFACT -> chunk.artifact() != null
                    || chunk.memoryType() == MemoryType.TECHNICAL
                    || chunk.memoryType() == MemoryType.REFERENCE;
            case DECISION -> chunk.memoryType() == MemoryType.DECISION
                    || chunk.interactionType() == InteractionType.DECISION
                    || mentionsDecision(chunk.content());
        };
    }

    private static boolean mentionsDecision(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        return lower.contains("decid") || lower.contains("agreed");
    }

    public List<HistoricalChunk> pool(ReferenceType type) {
        return pools.get(type);
    }

    /** Every historical chunk, most recent first. */
    public List<HistoricalChunk> recentFirst() {
        return recentFirst;
    }

    public WordSetCache words() {
        return words;
    }

    public int size() {
        return recentFirst.size();
    }
}
