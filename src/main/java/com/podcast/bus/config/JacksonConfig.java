package com.podcast.bus.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Central Jackson configuration.
 *
 * <ul>
 *   <li>{@link JavaTimeModule}: event timestamps are {@code java.time.Instant}.</li>
 *   <li>ISO-8601 text instead of numeric timestamps, so payloads stay readable in {@code redis-cli}.</li>
 *   <li>Unknown properties are ignored: producers may add fields before every consumer is upgraded.</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return newObjectMapper();
    }

    /** Same settings outside a Spring context, e.g. in tests. */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
