package com.openforge.meetingmemory.enrich;

import com.openforge.meetingmemory.chunk.ChunkDraft;
import com.openforge.meetingmemory.chunk.InteractionType;
import com.openforge.meetingmemory.chunk.MeetingMetadata;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import com.openforge.meetingmemory.chunk.MemoryType;
import com.openforge.meetingmemory.config.TemporalProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkFactoryTest {

    private static final Instant START = Instant.parse("2024-05-02T13:00:00Z");

    private final ChunkFactory factory = new ChunkFactory(TemporalProperties.defaults());

    @Test
    void assignsSequentialIdsAndMeetingTimestamps() {
        List<MemoryChunk> chunks = factory.create(MeetingMetadata.of("weekly-42", START), List.of(
                ChunkDraft.builder().content("first").offset(Duration.ofMinutes(2)).build(),
                ChunkDraft.builder().content("second").offset(Duration.ofMinutes(5)).build(),
                ChunkDraft.builder().content("third").build()));

        assertThat(chunks).extracting(MemoryChunk::getChunkId)
                .containsExactly("weekly-42_chunk_0", "weekly-42_chunk_1", "weekly-42_chunk_2");
        assertThat(chunks).extracting(MemoryChunk::getMeetingId).containsOnly("weekly-42");
        assertThat(chunks.get(0).getTimestamp()).isEqualTo(START.plus(Duration.ofMinutes(2)));
        assertThat(chunks.get(1).getTimestamp()).isEqualTo(START.plus(Duration.ofMinutes(5)));
        // no offset: never earlier than the chunk before it
        assertThat(chunks.get(2).getTimestamp()).isEqualTo(START.plus(Duration.ofMinutes(5)));
    }

    @Test
    void completesMissingFieldsWithDefaults() {
        MemoryChunk chunk = factory.create(MeetingMetadata.of("m", START), List.of(
                ChunkDraft.builder()
                        .speaker("  ")
                        .content("  We ship on Friday  ")
                        .topicsDiscussed(Arrays.asList("release", "", null, " launch "))
                        .build())).get(0);

        assertThat(chunk.getSpeaker()).isEqualTo("unknown");
        assertThat(chunk.getInteractionType()).isEqualTo(InteractionType.DISCUSSION);
        assertThat(chunk.getMemoryType()).isEqualTo(MemoryType.TOPIC);
        assertThat(chunk.getContent()).isEqualTo("We ship on Friday");
        assertThat(chunk.getTopicsDiscussed()).containsExactly("release", "launch");
        assertThat(chunk.getImportanceScore()).isEqualTo(5.0);
        assertThat(chunk.getConfidence()).isEqualTo(0.8);
    }

    @Test
    void clampsScoresAndDerivesMemoryType() {
        MemoryChunk chunk = factory.create(MeetingMetadata.of("m", START), List.of(
                ChunkDraft.builder()
                        .speaker("Sam")
                        .interactionType(InteractionType.COMMITMENT)
                        .content("I'll send the numbers")
                        .importanceScore(14.0)
                        .confidence(-0.2)
                        .build())).get(0);

        assertThat(chunk.getMemoryType()).isEqualTo(MemoryType.COMMITMENT);
        assertThat(chunk.getImportanceScore()).isEqualTo(10.0);
        assertThat(chunk.getConfidence()).isEqualTo(0.0);
    }

    @Test
    void configuredDefaultsApply() {
        TemporalProperties properties = new TemporalProperties(
                TemporalProperties.defaults().reference(),
                TemporalProperties.defaults().drift(),
                TemporalProperties.defaults().query(),
                new TemporalProperties.Draft(3.0, 0.5));

        MemoryChunk chunk = new ChunkFactory(properties)
                .create(MeetingMetadata.of("m", START), List.of(ChunkDraft.builder().content("x").build())).get(0);

        assertThat(chunk.getImportanceScore()).isEqualTo(3.0);
        assertThat(chunk.getConfidence()).isEqualTo(0.5);
    }
}
