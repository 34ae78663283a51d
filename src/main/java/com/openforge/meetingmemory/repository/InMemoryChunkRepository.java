package com.openforge.meetingmemory.repository;

import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.enrich.ChunkStore;
import com.openforge.meetingmemory.query.ChunkRetriever;
import com.openforge.meetingmemory.query.QueryPlan;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Process-local chunk store for running the engine without a vector or graph
 * database.
 *
 * Retrieval widens step by step so that enrichment rounds can find more:
 *   initial    type + scope + entity filters
 *   round 1    entity filter dropped
 *   round 2    type filter dropped
 *   round 3+   scope filter dropped
 *
 * The scope window is measured back from the newest stored chunk, not from
 * the wall clock.
 */
@Slf4j
public class InMemoryChunkRepository implements ChunkStore, ChunkRetriever {

    private final Map<String, MemoryChunk> chunks = new LinkedHashMap<>();
    private final int                      pageSize;

    public InMemoryChunkRepository(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public synchronized void store(List<MemoryChunk> batch) {
        batch.forEach(chunk -> chunks.put(chunk.getChunkId(), chunk));
        log.debug("[ChunkRepository] Stored {} chunk(s), {} total", batch.size(), chunks.size());
    }

    @Override
    public List<MemoryChunk> retrieve(QueryPlan plan) {
        return search(plan, 0);
    }

    @Override
    public List<MemoryChunk> retrieveMore(QueryPlan plan, List<MemoryChunk> context, int iteration) {
        return search(plan, iteration);
    }

    public synchronized int size() {
        return chunks.size();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private synchronized List<MemoryChunk> search(QueryPlan plan, int widening) {
        Predicate<MemoryChunk> filter = c -> true;
        if (widening < 1) filter = filter.and(mentionsAny(plan.entities()));
        if (widening < 2) filter = filter.and(ofTypes(plan));
        if (widening < 3) filter = filter.and(withinScope(plan));

        List<MemoryChunk> found = new ArrayList<>();
        for (MemoryChunk chunk : chunks.values()) {
            if (filter.test(chunk)) found.add(chunk);
        }
        found.sort(Comparator.comparingDouble(MemoryChunk::getImportanceScore).reversed());
        return found.size() > pageSize ? new ArrayList<>(found.subList(0, pageSize)) : found;
    }

    private static Predicate<MemoryChunk> mentionsAny(List<String> entities) {
        if (entities.isEmpty()) return c -> true;
        return chunk -> entities.stream().anyMatch(entity ->
                chunk.getContent().toLowerCase(Locale.ROOT).contains(entity.toLowerCase(Locale.ROOT))
                        || chunk.getTerms().stream().anyMatch(term -> term.equalsIgnoreCase(entity))
                        || chunk.referencesPerson(entity));
    }

    private static Predicate<MemoryChunk> ofTypes(QueryPlan plan) {
        if (plan.requiredContextTypes().isEmpty()) return c -> true;
        return chunk -> plan.requiredContextTypes().contains(chunk.getMemoryType());
    }

    private Predicate<MemoryChunk> withinScope(QueryPlan plan) {
        Duration window = plan.temporalScope().window();
        if (window == null) return c -> true;
        Instant newest = chunks.values().stream()
                .map(MemoryChunk::getTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        if (newest == null) return c -> true;
        Instant from = newest.minus(window);
        return chunk -> chunk.getTimestamp() == null || !chunk.getTimestamp().isBefore(from);
    }
}
