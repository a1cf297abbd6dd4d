package com.example.jobsync.service;

import com.example.jobsync.domain.entity.Job;
import com.example.jobsync.domain.enums.SyncAction;
import com.example.jobsync.domain.repository.JobRepository;
import com.example.jobsync.dto.CreateJobRequest;
import com.example.jobsync.dto.JobResponse;
import com.example.jobsync.dto.ResyncReport;
import com.example.jobsync.dto.UpdateJobRequest;
import com.example.jobsync.exception.DuplicateJobException;
import com.example.jobsync.exception.JobNotFoundException;
import com.example.jobsync.exception.SchedulerException;
import com.example.jobsync.mapper.JobMapper;
import com.example.jobsync.service.namespace.DashboardLinks;
import com.example.jobsync.service.namespace.NamespaceCodec;
import com.example.jobsync.service.sync.JobSyncService;
import com.example.jobsync.service.sync.MergeMode;
import com.example.jobsync.service.sync.SyncResult;
import com.example.jobsync.service.validation.JobValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Service for administering job definitions.
 * <p>
 * Local state is the source of truth: writes are committed first and then pushed to the
 * scheduler on a best-effort basis. A failed push is logged and reported back in the
 * response, the local change stays.
 * <p>
 * Mutating methods are deliberately not transactional so the repository commits before
 * any network call is made.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    private final JobRepository jobRepository;
    private final JobSyncService jobSyncService;
    private final JobValidator jobValidator;
    private final JobMapper jobMapper;
    private final NamespaceCodec namespaceCodec;
    private final DashboardLinks dashboardLinks;

    // === Create / Update ===

    public JobResponse createJob(CreateJobRequest request) {
        var name = jobValidator.normalizeName(request.getName());
        if (jobRepository.existsByName(name)) {
            throw new DuplicateJobException(name);
        }
        var schedule = jobValidator.normalizeSchedule(name, request.getSchedule());

        var job = jobMapper.toEntity(request);
        job.setName(name);
        job.setSchedule(schedule);
        job = jobRepository.save(job);
        log.info("Created job {} ({})", job.getName(), job.getSchedule());

        var response = toResponse(job);
        response.setSyncError(push(job));
        return response;
    }

    public JobResponse updateJob(String name, UpdateJobRequest request) {
        var job = findJob(name);

        if (request.getSchedule() != null) {
            request.setSchedule(jobValidator.normalizeSchedule(job.getName(), request.getSchedule()));
        }
        if (request.getCommand() != null && request.getCommand().isBlank()) {
            request.setCommand(null);
        }

        jobMapper.updateJob(request, job);
        job = jobRepository.save(job);
        log.info("Updated job {}", job.getName());

        var response = toResponse(job);
        response.setSyncError(push(job));
        return response;
    }

    // === Retrieval ===

    @Transactional(readOnly = true)
    public JobResponse getJob(String name) {
        return toResponse(findJob(name));
    }

    @Transactional(readOnly = true)
    public List<JobResponse> listJobs() {
        var jobs = jobRepository.findAllByOrderByNameAsc();
        var responses = jobMapper.toResponseList(jobs);
        for (var response : responses) {
            decorate(response);
        }
        return responses;
    }

    // === Delete ===

    /**
     * Remove a job locally, then from the scheduler
     */
    public JobResponse deleteJob(String name) {
        var job = findJob(name);
        jobRepository.delete(job);
        log.info("Deleted job {}", job.getName());

        var response = toResponse(job);
        try {
            jobSyncService.deleteJob(job);
        } catch (SchedulerException e) {
            log.warn("Job {} deleted locally but not from the scheduler: {}", job.getName(), e.getMessage());
            response.setSyncError(e.getMessage());
        }
        return response;
    }

    // === Bulk ===

    /**
     * Set the enabled flag on every named job, then push each one.
     * Unknown names and failed pushes are listed as errors; local writes are kept.
     */
    public ResyncReport setEnabled(Collection<String> names, boolean enabled) {
        var wanted = names.stream().map(n -> n.toLowerCase(Locale.ROOT)).distinct().toList();
        var jobs = jobRepository.findByNameIn(wanted);
        var errors = new ArrayList<SyncResult>();

        var found = jobs.stream().map(Job::getName).toList();
        for (var name : wanted) {
            if (!found.contains(name)) {
                errors.add(SyncResult.updateFailed(name, "Job not found"));
            }
        }

        jobs.forEach(job -> job.setEnabled(enabled));
        jobs = jobRepository.saveAll(jobs);
        log.info("{} {} jobs", enabled ? "Enabled" : "Disabled", jobs.size());

        var updated = 0;
        for (var job : jobs) {
            try {
                jobSyncService.syncJob(job);
                updated++;
            } catch (SchedulerException e) {
                log.warn("Failed to sync {} config with the scheduler: {}", job.getName(), e.getMessage());
                errors.add(SyncResult.updateFailed(job.getName(), e.getMessage()));
            }
        }

        return ResyncReport.builder().updated(updated).deleted(0).errors(errors).build();
    }

    // === Reconciliation ===

    /**
     * Run a full reconciliation pass on demand
     *
     * @throws SchedulerException if the remote job list cannot be fetched
     */
    public ResyncReport resync() {
        var results = jobSyncService.resyncAll();

        var updated = 0;
        var deleted = 0;
        var errors = new ArrayList<SyncResult>();
        for (var result : results) {
            if (!result.isSuccess()) {
                errors.add(result);
            } else if (result.getAction() == SyncAction.UPDATE) {
                updated++;
            } else {
                deleted++;
            }
        }

        log.info("{} updated and {} deleted, {} errors", updated, deleted, errors.size());
        return ResyncReport.builder().updated(updated).deleted(deleted).errors(errors).build();
    }

    // === Helpers ===

    private Job findJob(String name) {
        return jobRepository.findByName(name.toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new JobNotFoundException(name));
    }

    /**
     * Push to the scheduler, merging into the remote copy
     *
     * @return the failure message, or null when the push succeeded
     */
    private String push(Job job) {
        try {
            jobSyncService.syncJob(job, MergeMode.fetchAndMerge());
            return null;
        } catch (SchedulerException e) {
            log.warn("Job {} saved but not synced to the scheduler: {}", job.getName(), e.getMessage());
            return e.getMessage();
        }
    }

    private JobResponse toResponse(Job job) {
        return decorate(jobMapper.toResponse(job));
    }

    private JobResponse decorate(JobResponse response) {
        response.setWireName(namespaceCodec.addNamespace(response.getName()));
        response.setExecutionsUrl(dashboardLinks.executions(response.getName()));
        return response;
    }
}
