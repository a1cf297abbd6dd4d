package com.example.jobsync.service.sync;

import com.example.jobsync.config.ShedLockConfig;
import com.example.jobsync.exception.SchedulerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic reconciliation pass, for self-healing drift between local definitions and
 * the scheduler (e.g. rows deleted in bulk without going through this service).
 * <p>
 * Disabled unless {@code job-sync.resync.cron} is set. ShedLock keeps it to one
 * instance at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledResyncService {

    private final JobSyncService jobSyncService;

    @Scheduled(cron = "${job-sync.resync.cron:-}")
    @SchedulerLock(name = ShedLockConfig.RESYNC_LOCK,
            lockAtLeastFor = ShedLockConfig.LOCK_AT_LEAST_FOR,
            lockAtMostFor = ShedLockConfig.LOCK_AT_MOST_FOR)
    public void resync() {
        log.info("Starting scheduled reconciliation pass");

        try {
            jobSyncService.resyncAll(result -> {
                if (!result.isSuccess()) {
                    log.error("Job {} {} failed: {}", result.getJobName(), result.getAction().name().toLowerCase(), result.getError());
                }
            });
        } catch (SchedulerException e) {
            log.error("Scheduled reconciliation aborted, could not list remote jobs: {}", e.getMessage());
        }
    }
}
