package com.example.jobsync.config;

import com.example.jobsync.domain.repository.JobRepository;
import com.example.jobsync.service.sync.SyncResult;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring job sync health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts (enabled, disabled, last run failed)
 * - Reconciliation outcomes per action
 * - Webhook deliveries per outcome
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobRepository jobRepository;

    private final ConcurrentHashMap<String, AtomicLong> jobCounters = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        registerJobGauge("enabled", "Number of enabled jobs");
        registerJobGauge("disabled", "Number of disabled jobs");
        registerJobGauge("last_run_failed", "Number of jobs whose last run failed");
    }

    private void registerJobGauge(String state, String description) {
        var counter = new AtomicLong(0);
        jobCounters.put(state, counter);

        Gauge.builder("job_sync_jobs", counter, AtomicLong::get)
                .tag("state", state)
                .description(description)
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${job-sync.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        jobCounters.get("enabled").set(jobRepository.countByEnabled(true));
        jobCounters.get("disabled").set(jobRepository.countByEnabled(false));
        jobCounters.get("last_run_failed").set(jobRepository.countByLastRunSuccess(false));
    }

    /**
     * Record one job outcome of a reconciliation pass
     */
    public void recordSyncResult(SyncResult result) {
        meterRegistry.counter("job_sync_results",
                "action", result.getAction().name().toLowerCase(),
                "outcome", result.isSuccess() ? "success" : "failure"
        ).increment();
    }

    /**
     * Record a webhook delivery by HTTP status returned
     */
    public void recordWebhook(int status) {
        meterRegistry.counter("job_sync_webhooks", "status", String.valueOf(status)).increment();
    }
}
