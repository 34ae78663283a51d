package com.openforge.meetingmemory.enrich;

import com.openforge.meetingmemory.chunk.ChunkDraft;
import com.openforge.meetingmemory.chunk.HistoricalContext;
import com.openforge.meetingmemory.chunk.MeetingMetadata;

import java.util.List;

/**
 * Extraction collaborator: turns one transcript segment into chunk drafts,
 * typically through an LLM call. Implementations may throw any runtime
 * exception; the ingestion service wraps it.
 */
public interface ChunkExtractor {

    List<ChunkDraft> extract(String segment, MeetingMetadata meeting, HistoricalContext history);
}
