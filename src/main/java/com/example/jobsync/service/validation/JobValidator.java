package com.example.jobsync.service.validation;

import com.example.jobsync.config.ValidationProperties;
import com.example.jobsync.domain.entity.Job;
import com.example.jobsync.exception.JobValidationException;
import com.example.jobsync.exception.SchedulerException;
import com.example.jobsync.exception.SchedulerRejectedException;
import com.example.jobsync.service.sync.JobSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks job definitions before they are stored or pushed.
 * <p>
 * Names are case-insensitive and stored lowercased. Schedules starting with {@code *}
 * are refused since the scheduler's cron has a seconds field, so such a job would fire
 * every second.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobValidator {

    static final String PROBE_JOB_NAME = "tmp_test_job";
    static final String PROBE_COMMAND = "echo validator";

    private static final String PARENT_KEYWORD = Job.PARENT_PREFIX.trim();
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    private final ValidationProperties validationProperties;
    private final JobSyncService jobSyncService;

    /**
     * @return the name in its stored (lowercase) form
     * @throws JobValidationException if the name is empty or has characters outside {@code [A-Za-z0-9_-]}
     */
    public String normalizeName(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new JobValidationException("name", "Invalid value '" + name + "'");
        }
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Validate a schedule for the job called {@code jobName} (already normalized).
     *
     * @return the schedule as it should be stored; a {@code @parent} target is lowercased
     * @throws JobValidationException if the schedule is unusable
     */
    public String normalizeSchedule(String jobName, String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new JobValidationException("schedule", "Schedule is required");
        }
        var trimmed = schedule.trim();

        if (trimmed.startsWith("*")) {
            throw new JobValidationException("schedule",
                    "Job schedule cannot start with * as this will schedule a job to start every second");
        }

        if (trimmed.equals(PARENT_KEYWORD) || trimmed.startsWith(Job.PARENT_PREFIX)) {
            var parent = trimmed.substring(PARENT_KEYWORD.length()).trim();
            if (parent.isEmpty() || !NAME_PATTERN.matcher(parent).matches()) {
                throw new JobValidationException("schedule", "Invalid parent job '" + parent + "'");
            }
            parent = parent.toLowerCase(Locale.ROOT);
            if (parent.equals(jobName)) {
                throw new JobValidationException("schedule", "A job cannot be its own parent");
            }
            return Job.PARENT_PREFIX + parent;
        }

        if (validationProperties.isProbeSchedule()) {
            probe(trimmed);
        }
        return trimmed;
    }

    /**
     * Let the scheduler parse the schedule by pushing a disabled throwaway job
     */
    private void probe(String schedule) {
        var probeJob = Job.builder()
                .name(PROBE_JOB_NAME)
                .schedule(schedule)
                .command(PROBE_COMMAND)
                .enabled(false)
                .build();

        try {
            jobSyncService.syncJob(probeJob);
        } catch (SchedulerRejectedException e) {
            log.info("Scheduler rejected schedule '{}': {}", schedule, e.getResponseBody());
            throw new JobValidationException("schedule", "Rejected by scheduler: " + e.getResponseBody());
        }

        try {
            jobSyncService.deleteJob(probeJob);
        } catch (SchedulerException e) {
            log.warn("Could not remove probe job {}: {}", PROBE_JOB_NAME, e.getMessage());
        }
    }
}
