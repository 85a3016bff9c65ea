package com.vidnyan.gae.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vidnyan.gae.domain.check.GrammarCheck;
import com.vidnyan.gae.domain.pattern.PatternDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for GAE components.
 */
@Slf4j
@Configuration
public class GaeConfiguration {

    /**
     * ObjectMapper for rendering results as JSON.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log available checks and detectors on startup.
     */
    @Bean
    public String logStages(List<GrammarCheck> checks, List<PatternDetector> detectors) {
        log.info("Registered {} grammar checks:", checks.size());
        checks.forEach(c -> log.info("  - {} ({})", c.getName(), c.category()));
        log.info("Registered {} pattern detectors:", detectors.size());
        detectors.forEach(d -> log.info("  - {} ({})", d.getName(), d.kind().label()));
        return "stages-logged";
    }
}
