package com.openforge.meetingmemory.config;

import com.openforge.meetingmemory.repository.InMemoryChunkRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default storage + retrieval collaborator.
 *
 * Deployments backed by a vector or graph store set
 * {@code meeting.store.in-memory.enabled=false} and register their own
 * ChunkStore / ChunkRetriever beans.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "meeting.store.in-memory.enabled", havingValue = "true", matchIfMissing = true)
public class CollaboratorConfig {

    @Bean
    public InMemoryChunkRepository inMemoryChunkRepository(
            @Value("${meeting.store.in-memory.page-size:10}") int pageSize) {
        log.info("[ChunkRepository] Using in-memory chunk store (page size {})", pageSize);
        return new InMemoryChunkRepository(pageSize);
    }
}
