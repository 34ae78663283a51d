package com.openforge.meetingmemory.enrich;

import com.openforge.meetingmemory.CollaboratorException;
import com.openforge.meetingmemory.CollaboratorException.Collaborator;
import com.openforge.meetingmemory.chunk.ChunkDraft;
import com.openforge.meetingmemory.chunk.HistoricalContext;
import com.openforge.meetingmemory.chunk.MeetingMetadata;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * End-to-end ingestion of one meeting:
 *
 *   segments ─▶ ChunkExtractor ─▶ ChunkFactory ─▶ ChunkEnricher ─▶ ChunkStore
 *
 * Segmentation happens upstream; this service receives the segments ready-made.
 * Extraction and storage failures surface as {@link CollaboratorException}.
 * Storage goes through a circuit breaker but is never retried here.
 */
@Slf4j
@Service
public class MeetingIngestionService {

    /** May be null when no extraction collaborator is deployed; drafts can still be ingested directly. */
    private final ChunkExtractor extractor;
    private final ChunkFactory   chunkFactory;
    private final ChunkEnricher  enricher;
    private final ChunkStore     chunkStore;
    private final CircuitBreaker storageCircuitBreaker;

    public MeetingIngestionService(@Nullable ChunkExtractor extractor,
                                   ChunkFactory chunkFactory,
                                   ChunkEnricher enricher,
                                   ChunkStore chunkStore,
                                   CircuitBreaker storageCircuitBreaker) {
        this.extractor             = extractor;
        this.chunkFactory          = chunkFactory;
        this.enricher              = enricher;
        this.chunkStore            = chunkStore;
        this.storageCircuitBreaker = storageCircuitBreaker;
        if (extractor == null) {
            log.warn("[Ingest] No ChunkExtractor available — only pre-extracted drafts can be ingested.");
        }
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public IngestionSummary ingest(MeetingMetadata meeting, List<String> segments, HistoricalContext history) {
        if (extractor == null) {
            throw new CollaboratorException(Collaborator.EXTRACTION, "No extraction collaborator configured");
        }
        List<ChunkDraft> drafts = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            drafts.addAll(extract(segments.get(i), i, meeting, history));
        }
        return ingestDrafts(meeting, drafts, history);
    }

    public IngestionSummary ingestDrafts(MeetingMetadata meeting, List<ChunkDraft> drafts, HistoricalContext history) {
        List<MemoryChunk> chunks = chunkFactory.create(meeting, drafts);
        EnrichmentResult result  = enricher.enrich(chunks, history);
        store(meeting, result.chunks());

        IngestionSummary summary = IngestionSummary.of(meeting.meetingId(), result);
        log.info("[Ingest] Meeting {} stored: {}", meeting.meetingId(), summary);
        return summary;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<ChunkDraft> extract(String segment, int index, MeetingMetadata meeting, HistoricalContext history) {
        try {
            List<ChunkDraft> drafts = extractor.extract(segment, meeting, history);
            return drafts == null ? List.of() : drafts;
        } catch (CollaboratorException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Ingest] Extraction failed for segment {} of meeting {}: {}",
                    index, meeting.meetingId(), e.getMessage());
            throw new CollaboratorException(Collaborator.EXTRACTION,
                    "Extraction failed for segment %d of meeting %s".formatted(index, meeting.meetingId()), e);
        }
    }

    private void store(MeetingMetadata meeting, List<MemoryChunk> chunks) {
        Runnable decorated = CircuitBreaker.decorateRunnable(storageCircuitBreaker, () -> chunkStore.store(chunks));
        try {
            decorated.run();
        } catch (Exception e) {
            log.warn("[Ingest] Storing {} chunk(s) of meeting {} failed: {}",
                    chunks.size(), meeting.meetingId(), e.getMessage());
            throw new CollaboratorException(Collaborator.STORAGE,
                    "Storage failed for meeting " + meeting.meetingId(), e);
        }
    }
}
