package com.pokerpulse.enrichment.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

@Configuration
@ConditionalOnProperty(name = "spring.flyway.enabled", havingValue = "true", matchIfMissing = true)
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            try {
                log.info("[Flyway] repair before migrate, locations={}", Arrays.toString(flyway.getConfiguration().getLocations()));
                flyway.repair();
            } catch (Exception ex) {
                log.warn("[Flyway] repair skipped: {}", ex.getMessage());
            }
            flyway.migrate();
        };
    }
}
