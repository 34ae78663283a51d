package com.openforge.meetingmemory.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Core infrastructure beans.
 */
@Configuration
public class AppConfig {

    /**
     * Shared ObjectMapper for everything handed to collaborators:
     *  - snake_case property names (chunk_id, references_past, query_type …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return meetingMemoryMapper();
    }

    public static ObjectMapper meetingMemoryMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
