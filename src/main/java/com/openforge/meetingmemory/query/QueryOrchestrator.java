package com.openforge.meetingmemory.query;

import com.openforge.meetingmemory.CollaboratorException;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.config.ResilientCall;
import com.openforge.meetingmemory.config.TemporalProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Query pipeline:
 *
 *   process(query)
 *     └─ QueryPlan.from(query)                         classify + scope + entities
 *     └─ retriever.retrieve(plan)                      initial context
 *     └─ while iterations < max && unique < sufficient
 *           └─ retriever.retrieveMore(plan, context, iteration)
 *     └─ de-duplicate by chunk id (first seen wins)
 *     └─ stable sort by importance, descending
 *
 * Every retriever call goes through the "retrieval" circuit breaker + retry.
 * A call that still fails aborts the query with a RETRIEVAL
 * {@link CollaboratorException}; no partial result is returned.
 */
@Slf4j
@Service
public class QueryOrchestrator {

    static final Comparator<MemoryChunk> BY_IMPORTANCE_DESC =
            Comparator.comparingDouble(MemoryChunk::getImportanceScore).reversed();

    private final ChunkRetriever     retriever;
    private final CircuitBreaker     retrievalCb;
    private final Retry              retrievalRetry;
    private final TemporalProperties.Query limits;

    public QueryOrchestrator(TemporalProperties properties,
                             ChunkRetriever retriever,
                             CircuitBreaker retrievalCircuitBreaker,
                             Retry retrievalRetry) {
        this.retriever      = retriever;
        this.retrievalCb    = retrievalCircuitBreaker;
        this.retrievalRetry = retrievalRetry;
        this.limits         = properties.query();
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public QueryResult process(String query) {
        QueryPlan plan = QueryPlan.from(query);
        log.debug("[Query] '{}' classified as {} (scope={}, entities={})",
                query, plan.queryType(), plan.temporalScope(), plan.entities());

        Map<String, MemoryChunk> unique = new LinkedHashMap<>();
        collect(unique, call(() -> retriever.retrieve(plan)));

        int iterations = 0;
        while (iterations < limits.maxEnrichIterations() && unique.size() < limits.sufficientChunks()) {
            iterations++;
            List<MemoryChunk> context   = List.copyOf(unique.values());
            int               iteration = iterations;
            int               before    = unique.size();
            collect(unique, call(() -> retriever.retrieveMore(plan, context, iteration)));
            log.debug("[Query] Enrichment round {}: {} → {} unique chunks",
                    iteration, before, unique.size());
        }

        List<MemoryChunk> ranked = rank(unique.values());
        log.info("[Query] {} query answered from {} chunks after {} enrichment round(s)",
                plan.queryType(), ranked.size(), iterations);
        return new QueryResult(plan.queryType(), ranked, iterations, plan);
    }

    /**
     * Drops repeated chunk ids, keeping the first occurrence, then orders by
     * importance descending. {@link List#sort} is stable, so equal scores keep
     * retrieval order.
     */
    public static List<MemoryChunk> deduplicateAndRank(List<MemoryChunk> chunks) {
        Map<String, MemoryChunk> unique = new LinkedHashMap<>();
        collect(unique, chunks);
        return rank(unique.values());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<MemoryChunk> call(Supplier<List<MemoryChunk>> retrieval) {
        List<MemoryChunk> result = ResilientCall.execute(retrievalCb, retrievalRetry,
                CollaboratorException.Collaborator.RETRIEVAL, retrieval);
        return result == null ? List.of() : result;
    }

    private static void collect(Map<String, MemoryChunk> unique, List<MemoryChunk> chunks) {
        for (MemoryChunk chunk : chunks) {
            if (chunk != null) unique.putIfAbsent(chunk.getChunkId(), chunk);
        }
    }

    private static List<MemoryChunk> rank(Iterable<MemoryChunk> chunks) {
        List<MemoryChunk> ranked = new ArrayList<>();
        chunks.forEach(ranked::add);
        ranked.sort(BY_IMPORTANCE_DESC);
        return ranked;
    }
}
