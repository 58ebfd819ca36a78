package com.vidnyan.attackpath.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.vidnyan.attackpath.domain.logic.LogicResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.List;

/**
 * Spring configuration for the attack path engine.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class AttackPathConfiguration {

    /**
     * ObjectMapper for the JSON reports.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }

    /**
     * Log available gate resolvers on startup.
     */
    @Bean
    public String logResolvers(List<LogicResolver> resolvers) {
        log.debug("Registered {} logic resolvers:", resolvers.size());
        resolvers.forEach(r -> log.debug("  - {} ({})", r.getClass().getSimpleName(), r.policy()));
        return "resolvers-logged";
    }
}
