package com.example.linkservice.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * ShedLock for the in-process edge sync trigger.
 *
 * Loaded only with edge-sync.scheduler.enabled=true. Then, with several replicas, only the
 * replica holding {@link #EDGE_SYNC_LOCK} runs a scheduled sync. HTTP-triggered and startup
 * syncs are never locked.
 *
 * Database table: shedlock (created by migration V2)
 */
@Configuration
@ConditionalOnProperty(name = "edge-sync.scheduler.enabled", havingValue = "true")
@EnableSchedulerLock(defaultLockAtMostFor = ShedLockConfig.EDGE_SYNC_LOCK_AT_MOST_FOR)
public class ShedLockConfig {

    public static final String EDGE_SYNC_LOCK = "edgeCacheSync";

    // Below the default 15 minute tick
    public static final String EDGE_SYNC_LOCK_AT_MOST_FOR = "13m";
    public static final String EDGE_SYNC_LOCK_AT_LEAST_FOR = "30s";

    static final String LOCK_TABLE = "shedlock";

    @Bean
    public LockProvider edgeSyncLockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(JdbcTemplateLockProvider.Configuration.builder()
                .withJdbcTemplate(new JdbcTemplate(dataSource))
                .withTableName(LOCK_TABLE)
                .usingDbTime()
                .build());
    }
}
