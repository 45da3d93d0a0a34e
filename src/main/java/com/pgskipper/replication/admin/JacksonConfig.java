package com.pgskipper.replication.admin;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Central Jackson configuration for the admin API.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Serialize {@code java.time} values (health check timestamps) as ISO-8601 strings.</li>
 *   <li>Accept request bodies carrying fields this service does not know, so older and
 *       newer clients keep working.</li>
 *   <li>Provide the single {@link ObjectMapper} the WebFlux codecs use.</li>
 * </ul>
 *
 * Field omission rules (empty row filter, tables not requested) live on the
 * response records themselves.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Unknown request fields are ignored rather than rejected.
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }
}
