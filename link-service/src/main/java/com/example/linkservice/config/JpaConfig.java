package com.example.linkservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * JPA configuration.
 *
 * Auditing fills created_at and updated_at of links. The columns carry no zone, so they are
 * written in UTC like expires_at and the sync history timestamps.
 */
@Configuration
@EnableJpaAuditing(dateTimeProviderRef = JpaConfig.AUDIT_TIME_PROVIDER)
public class JpaConfig {

    static final String AUDIT_TIME_PROVIDER = "utcAuditTimeProvider";

    @Bean(AUDIT_TIME_PROVIDER)
    public DateTimeProvider utcAuditTimeProvider() {
        return () -> Optional.of(LocalDateTime.now(ZoneOffset.UTC));
    }
}
