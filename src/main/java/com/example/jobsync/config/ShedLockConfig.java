package com.example.jobsync.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Cross-instance lock for the scheduled reconciliation pass.
 * <p>
 * Two passes running at once could interleave pushes and orphan deletes on the external
 * scheduler. Lock durations come from {@code job-sync.resync.lock-at-most-for} and
 * {@code job-sync.resync.lock-at-least-for}.
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = ShedLockConfig.LOCK_AT_MOST_FOR)
public class ShedLockConfig {

    public static final String RESYNC_LOCK = "jobResync";
    public static final String LOCK_AT_MOST_FOR = "${job-sync.resync.lock-at-most-for:10m}";
    public static final String LOCK_AT_LEAST_FOR = "${job-sync.resync.lock-at-least-for:10s}";

    /**
     * Locks live in the {@code shedlock} table created by the Flyway migration, timed by
     * the database clock so instances with skewed clocks agree on expiry.
     */
    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(
                JdbcTemplateLockProvider.Configuration.builder()
                        .withJdbcTemplate(new JdbcTemplate(dataSource))
                        .withTableName("shedlock")
                        .usingDbTime()
                        .build()
        );
    }
}
