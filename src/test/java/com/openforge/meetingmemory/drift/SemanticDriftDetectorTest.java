package com.openforge.meetingmemory.drift;

import com.openforge.meetingmemory.chunk.DriftRecord;
import com.openforge.meetingmemory.chunk.HistoricalChunk;
import com.openforge.meetingmemory.chunk.HistoricalContext;
import com.openforge.meetingmemory.chunk.HistoricalMeeting;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.config.TemporalProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticDriftDetectorTest {

    private static final Instant NOW = Instant.parse("2024-04-15T14:00:00Z");

    private final SemanticDriftDetector detector = new SemanticDriftDetector(TemporalProperties.defaults());

    private static TermUsageIndex usages(int count, String content) {
        List<HistoricalChunk> chunks = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            chunks.add(HistoricalChunk.builder()
                    .chunkId("h" + i)
                    .timestamp(NOW.minus(Duration.ofDays(i)))
                    .content(content)
                    .confidence(0.8)
                    .topics(List.of("schema"))
                    .build());
        }
        return TermUsageIndex.build(HistoricalContext.of(
                new HistoricalMeeting("m0", NOW.minus(Duration.ofDays(count)), List.of(), chunks)));
    }

    private static MemoryChunk chunk(String content, List<String> topics, List<String> entities) {
        return MemoryChunk.builder()
                .chunkId("m1_chunk_0")
                .timestamp(NOW)
                .content(content)
                .topicsDiscussed(topics)
                .entitiesMentioned(entities)
                .build();
    }

    @Test
    void flagsATermUsedInNewVocabulary() {
        TermUsageIndex index = usages(4, "schema tables columns indexes migration");
        MemoryChunk chunk = chunk("the data model now covers customer journeys and pricing narratives",
                List.of("schema"), List.of("data model"));

        List<DriftRecord> drifts = detector.detect(chunk, index);

        assertThat(drifts).hasSize(1);
        DriftRecord drift = drifts.get(0);
        assertThat(drift.term()).isEqualTo("schema");
        assertThat(drift.averageOverlap()).isLessThan(0.3);
        assertThat(drift.historicalUsages()).isEqualTo(4);
        assertThat(drift.replacementTerm()).isEqualTo("data model");
        assertThat(chunk.getSemanticDrift()).containsExactly(drift);
        assertThat(chunk.getTopicsDiscussed()).containsExactly("schema");
    }

    @Test
    void comparesAtMostTheFiveMostRecentUsages() {
        TermUsageIndex index = usages(8, "schema tables columns indexes migration");
        MemoryChunk chunk = chunk("customer journeys", List.of("schema"), List.of());

        assertThat(detector.detect(chunk, index).get(0).historicalUsages()).isEqualTo(5);
    }

    @Test
    void fewerThanThreeUsagesIsNotEnoughEvidence() {
        TermUsageIndex index = usages(2, "schema tables columns indexes migration");
        MemoryChunk chunk = chunk("customer journeys", List.of("schema"), List.of());

        assertThat(detector.detect(chunk, index)).isEmpty();
        assertThat(chunk.getSemanticDrift()).isEmpty();
    }

    @Test
    void familiarVocabularyIsNotDrift() {
        TermUsageIndex index = usages(3, "schema tables columns indexes migration");
        MemoryChunk chunk = chunk("schema migration adds two tables and columns", List.of("Schema"), List.of());

        assertThat(detector.detect(chunk, index)).isEmpty();
    }

    @Test
    void driftWithoutANewTermHasNoReplacement() {
        TermUsageIndex index = usages(3, "schema tables columns indexes migration");
        MemoryChunk chunk = chunk("customer journeys", List.of("schema"), List.of());

        assertThat(detector.detect(chunk, index).get(0).replacementTerm()).isNull();
    }

    @Test
    void laterUsagesAreIgnored() {
        TermUsageIndex index = usages(3, "schema tables columns indexes migration");

        assertThat(index.usages("schema", NOW.minus(Duration.ofDays(2)))).extracting(HistoricalChunk::chunkId)
                .containsExactly("h2", "h3");
        assertThat(index.usages("tables", null)).hasSize(3);
        assertThat(index.usages("tab", null)).isEmpty();
    }
}
