package com.openforge.meetingmemory;

import com.openforge.meetingmemory.chunk.ChunkDraft;
import com.openforge.meetingmemory.chunk.HistoricalContext;
import com.openforge.meetingmemory.chunk.InteractionType;
import com.openforge.meetingmemory.chunk.MeetingMetadata;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.config.TemporalProperties;
import com.openforge.meetingmemory.enrich.IngestionSummary;
import com.openforge.meetingmemory.enrich.MeetingIngestionService;
import com.openforge.meetingmemory.query.QueryResult;
import com.openforge.meetingmemory.query.QueryService;
import com.openforge.meetingmemory.query.QueryType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "meeting.temporal.query.sufficient-chunks=2")
class MeetingMemoryApplicationTest {

    @Autowired
    private TemporalProperties properties;

    @Autowired
    private MeetingIngestionService ingestionService;

    @Autowired
    private QueryService queryService;

    @Test
    void bindsTheTemporalSettings() {
        assertThat(properties.reference().minScore()).isEqualTo(0.7);
        assertThat(properties.reference().windowHours()).isEqualTo(168);
        assertThat(properties.drift().minUsages()).isEqualTo(3);
        assertThat(properties.query().maxEnrichIterations()).isEqualTo(3);
        assertThat(properties.query().sufficientChunks()).isEqualTo(2);
    }

    @Test
    void ingestedChunksAreRetrievableByQuery() {
        Instant date = Instant.now().minus(Duration.ofDays(1));
        MeetingMetadata meeting = MeetingMetadata.of("pricing-sync", date);

        IngestionSummary summary = ingestionService.ingestDrafts(meeting, List.of(
                ChunkDraft.builder().speaker("Ana").interactionType(InteractionType.DECISION)
                        .content("We decided on tiered pricing").importanceScore(8.0).build(),
                ChunkDraft.builder().speaker("Ben").interactionType(InteractionType.DECISION)
                        .content("Enterprise pricing needs legal review").importanceScore(6.0)
                        .offset(Duration.ofMinutes(3)).build()),
                HistoricalContext.empty());

        QueryResult result = queryService.retrieve("what did we decide about pricing");

        assertThat(summary.chunkCount()).isEqualTo(2);
        assertThat(result.queryType()).isEqualTo(QueryType.DECISION_ARCHAEOLOGY);
        assertThat(result.results()).extracting(MemoryChunk::getChunkId)
                .startsWith("pricing-sync_chunk_0", "pricing-sync_chunk_1");
    }

    @Test
    void answeringWithoutAGeneratorFails() {
        assertThatThrownBy(() -> queryService.answer("status"))
                .isInstanceOf(CollaboratorException.class);
    }
}
