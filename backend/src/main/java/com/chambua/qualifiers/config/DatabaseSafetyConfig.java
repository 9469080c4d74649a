package com.chambua.qualifiers.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Refuses to start when Hibernate would drop or recreate the schema outside a test
 * profile. The probability table and run ledger are only ever changed through Flyway.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    private static final Set<String> DESTRUCTIVE_DDL = Set.of("create", "create-drop");

    private final Environment environment;

    public DatabaseSafetyConfig(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void verifySchemaSafety() {
        String ddl = environment.getProperty("spring.jpa.hibernate.ddl-auto", "validate")
                .trim().toLowerCase(Locale.ROOT).replace('_', '-');
        String url = environment.getProperty("spring.datasource.url", "");
        boolean testProfile = Arrays.stream(environment.getActiveProfiles())
                .anyMatch(p -> p.toLowerCase(Locale.ROOT).contains("test"));

        log.info("[DbSafety] profiles={} ddl-auto={} datasource={}",
                Arrays.toString(environment.getActiveProfiles()), ddl, url);

        if (DESTRUCTIVE_DDL.contains(ddl) && !testProfile) {
            throw new IllegalStateException("ddl-auto=" + ddl + " is only allowed under a test profile");
        }
        if (url.toLowerCase(Locale.ROOT).contains(":mem:") && !testProfile) {
            log.warn("[DbSafety] in-memory datasource outside tests; probability runs will not survive a restart");
        }
    }
}
