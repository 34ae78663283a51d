package com.openforge.meetingmemory.query;

import com.openforge.meetingmemory.CollaboratorException;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.config.TemporalProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryOrchestratorTest {

    private static final Instant T = Instant.parse("2024-06-10T09:00:00Z");

    private ChunkRetriever retriever;
    private QueryOrchestrator orchestrator;

    static MemoryChunk chunk(String id, double importance) {
        return MemoryChunk.builder()
                .chunkId(id)
                .timestamp(T)
                .content("content of " + id)
                .importanceScore(importance)
                .build();
    }

    static List<MemoryChunk> chunks(String prefix, int count) {
        List<MemoryChunk> list = new ArrayList<>();
        for (int i = 0; i < count; i++) list.add(chunk(prefix + i, 5.0));
        return list;
    }

    static Retry fastRetry() {
        return Retry.of("retrieval", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(UncheckedIOException.class)
                .build());
    }

    @BeforeEach
    void setUp() {
        retriever = Mockito.mock(ChunkRetriever.class);
        orchestrator = new QueryOrchestrator(TemporalProperties.defaults(), retriever,
                CircuitBreaker.ofDefaults("retrieval"), fastRetry());
    }

    @Nested
    @DisplayName("enrichment loop")
    class Loop {

        @Test
        @DisplayName("pricing decision: 0 then 4 chunks is still thin, so a third fetch happens")
        void fetchesAgainWhileContextIsThin() {
            when(retriever.retrieve(any())).thenReturn(List.of());
            when(retriever.retrieveMore(any(), anyList(), anyInt()))
                    .thenReturn(chunks("a", 4))
                    .thenReturn(chunks("b", 3));

            QueryResult result = orchestrator.process("what did we decide about pricing");

            assertThat(result.queryType()).isEqualTo(QueryType.DECISION_ARCHAEOLOGY);
            assertThat(result.iterations()).isEqualTo(2);
            assertThat(result.results()).hasSize(7);
            verify(retriever).retrieve(any());
            verify(retriever, times(2)).retrieveMore(any(), anyList(), anyInt());
            verify(retriever).retrieveMore(any(), eq(List.of()), eq(1));
        }

        @Test
        void stopsAfterThreeRoundsEvenIfEveryRoundBringsSomethingNew() {
            AtomicInteger counter = new AtomicInteger();
            when(retriever.retrieve(any())).thenReturn(List.of());
            when(retriever.retrieveMore(any(), anyList(), anyInt()))
                    .thenAnswer(inv -> List.of(chunk("new-" + counter.incrementAndGet(), 5.0)));

            QueryResult result = orchestrator.process("anything at all");

            assertThat(result.iterations()).isEqualTo(3);
            assertThat(result.results()).hasSize(3);
            verify(retriever, times(3)).retrieveMore(any(), anyList(), anyInt());
        }

        @Test
        void sufficientInitialContextSkipsEnrichment() {
            when(retriever.retrieve(any())).thenReturn(chunks("c", 5));

            QueryResult result = orchestrator.process("status of the migration");

            assertThat(result.iterations()).isZero();
            verify(retriever, never()).retrieveMore(any(), anyList(), anyInt());
        }

        @Test
        void duplicatesDoNotCountTowardsSufficiency() {
            when(retriever.retrieve(any())).thenReturn(chunks("c", 3));
            when(retriever.retrieveMore(any(), anyList(), anyInt())).thenReturn(chunks("c", 3));

            QueryResult result = orchestrator.process("status");

            assertThat(result.iterations()).isEqualTo(3);
            assertThat(result.results()).hasSize(3);
        }

        @Test
        void nullResultsCountAsEmpty() {
            when(retriever.retrieve(any())).thenReturn(null);
            when(retriever.retrieveMore(any(), anyList(), anyInt())).thenReturn(null);

            QueryResult result = orchestrator.process("status");

            assertThat(result.results()).isEmpty();
            assertThat(result.iterations()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {

        @Test
        void keepsTheFirstSeenCopyOfEachChunk() {
            MemoryChunk first = chunk("x", 3.0);
            MemoryChunk copy  = chunk("x", 9.0);

            List<MemoryChunk> ranked = QueryOrchestrator.deduplicateAndRank(List.of(first, chunk("y", 4.0), copy));

            assertThat(ranked).extracting(MemoryChunk::getChunkId).containsExactly("y", "x");
            assertThat(ranked.get(1)).isSameAs(first);
        }

        @Test
        void ranksByImportanceKeepingRetrievalOrderOnTies() {
            List<MemoryChunk> ranked = QueryOrchestrator.deduplicateAndRank(List.of(
                    chunk("low", 2.0), chunk("tie-1", 7.0), chunk("top", 9.5), chunk("tie-2", 7.0)));

            assertThat(ranked).extracting(MemoryChunk::getChunkId).containsExactly("top", "tie-1", "tie-2", "low");
        }

        @Test
        void everyIdAppearsExactlyOnce() {
            List<MemoryChunk> input = new ArrayList<>();
            for (int i = 0; i < 30; i++) input.add(chunk("id-" + (i % 7), 1.0 + i % 4));

            List<MemoryChunk> ranked = QueryOrchestrator.deduplicateAndRank(input);

            assertThat(ranked).extracting(MemoryChunk::getChunkId).doesNotHaveDuplicates().hasSize(7);
        }
    }

    @Nested
    @DisplayName("retrieval failures")
    class Failures {

        @Test
        void failureSurfacesAsARetrievalError() {
            when(retriever.retrieve(any())).thenThrow(new IllegalStateException("index offline"));

            assertThatThrownBy(() -> orchestrator.process("status"))
                    .isInstanceOf(CollaboratorException.class)
                    .hasRootCauseMessage("index offline")
                    .satisfies(e -> assertThat(((CollaboratorException) e).collaborator())
                            .isEqualTo(CollaboratorException.Collaborator.RETRIEVAL));
        }

        @Test
        void transientIoFailuresAreRetried() {
            when(retriever.retrieve(any()))
                    .thenThrow(new UncheckedIOException(new IOException("connection reset")))
                    .thenReturn(chunks("c", 5));

            QueryResult result = orchestrator.process("status");

            assertThat(result.results()).hasSize(5);
            verify(retriever, times(2)).retrieve(any());
        }

        @Test
        void failureDuringEnrichmentAbortsTheQuery() {
            when(retriever.retrieve(any())).thenReturn(chunks("c", 1));
            when(retriever.retrieveMore(any(), anyList(), anyInt())).thenThrow(new IllegalStateException("boom"));

            assertThatThrownBy(() -> orchestrator.process("status")).isInstanceOf(CollaboratorException.class);
        }
    }
}
