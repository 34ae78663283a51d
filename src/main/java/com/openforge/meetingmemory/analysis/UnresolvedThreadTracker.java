package com.openforge.meetingmemory.analysis;

import com.openforge.meetingmemory.chunk.InteractionType;
import com.openforge.meetingmemory.chunk.MemoryChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Finds questions without an answer. A question counts as answered when an
 * answer chunk at or after it is addressed to the person who asked.
 */
@Slf4j
@Component
public class UnresolvedThreadTracker {

    public List<UnresolvedThread> track(List<MemoryChunk> chunks, Instant now) {
        List<MemoryChunk> answers = chunks.stream()
                .filter(c -> c.getInteractionType() == InteractionType.ANSWER)
                .toList();

        List<UnresolvedThread> open = chunks.stream()
                .filter(c -> c.getInteractionType() == InteractionType.QUESTION)
                .filter(q -> answers.stream().noneMatch(a -> answers(a, q)))
                .map(q -> new UnresolvedThread(
                        q.getChunkId(),
                        q.getContent(),
                        q.getSpeaker(),
                        q.getMeetingId(),
                        q.getImportanceScore(),
                        daysSince(q.getTimestamp(), now)))
                .sorted(Comparator.comparingDouble(UnresolvedThread::importance).reversed())
                .toList();

        log.debug("[Threads] {} open question(s) among {} chunk(s)", open.size(), chunks.size());
        return open;
    }

    private static boolean answers(MemoryChunk answer, MemoryChunk question) {
        boolean addressed = answer.getAddressedTo().stream()
                .anyMatch(person -> person.equalsIgnoreCase(question.getSpeaker()));
        if (!addressed) return false;
        if (question.getTimestamp() == null) return true;
        return answer.getTimestamp() != null && !answer.getTimestamp().isBefore(question.getTimestamp());
    }

    private static long daysSince(Instant timestamp, Instant now) {
        if (timestamp == null) return 0;
        return Math.max(0, Duration.between(timestamp, now).toDays());
    }
}
