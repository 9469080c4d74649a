package com.chambua.qualifiers.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Repairs the schema history (failed migrations, checksum drift) before migrating. */
@Configuration
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            repairQuietly(flyway);
            int applied = flyway.migrate().migrationsExecuted;
            log.info("[Flyway] applied {} migration(s)", applied);
        };
    }

    private static void repairQuietly(Flyway flyway) {
        try {
            flyway.repair();
        } catch (FlywayException ex) {
            log.warn("[Flyway] repair skipped: {}", ex.getMessage());
        }
    }
}
