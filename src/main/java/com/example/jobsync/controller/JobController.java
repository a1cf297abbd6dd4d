package com.example.jobsync.controller;

import com.example.jobsync.dto.ApiResponse;
import com.example.jobsync.dto.BulkJobRequest;
import com.example.jobsync.dto.CreateJobRequest;
import com.example.jobsync.dto.JobResponse;
import com.example.jobsync.dto.ResyncReport;
import com.example.jobsync.dto.UpdateJobRequest;
import com.example.jobsync.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API controller for job administration.
 * <p>
 * Provides endpoints for:
 * - Creating, updating and deleting jobs
 * - Listing jobs with links into the scheduler dashboard
 * - Enabling and disabling jobs in bulk
 * - Triggering a full reconciliation with the scheduler
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Management", description = "APIs for managing jobs mirrored into the scheduler")
public class JobController {

    private final JobManagementService jobManagementService;

    // === Create / Update ===

    @PostMapping
    @Operation(summary = "Create a job", description = "Store a new job and push it to the scheduler")
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create job {} with schedule {}", request.getName(), request.getSchedule());

        var response = jobManagementService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, savedMessage("created", response)));
    }

    @PutMapping("/{name}")
    @Operation(summary = "Update a job", description = "Change a job's definition and push it to the scheduler")
    public ResponseEntity<ApiResponse<JobResponse>> updateJob(
            @Parameter(description = "Job name") @PathVariable String name,
            @Valid @RequestBody UpdateJobRequest request) {
        log.info("API: Update job {}", name);

        var response = jobManagementService.updateJob(name, request);
        return ResponseEntity.ok(ApiResponse.success(response, savedMessage("updated", response)));
    }

    // === Retrieval ===

    @GetMapping
    @Operation(summary = "List jobs", description = "List every job ordered by name")
    public ResponseEntity<ApiResponse<List<JobResponse>>> listJobs() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.listJobs()));
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get a job", description = "Retrieve a job by name")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job name") @PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(name)));
    }

    // === Delete ===

    @DeleteMapping("/{name}")
    @Operation(summary = "Delete a job", description = "Delete a job locally and from the scheduler")
    public ResponseEntity<ApiResponse<JobResponse>> deleteJob(@Parameter(description = "Job name") @PathVariable String name) {
        log.info("API: Delete job {}", name);

        var response = jobManagementService.deleteJob(name);
        return ResponseEntity.ok(ApiResponse.success(response, savedMessage("deleted", response)));
    }

    // === Bulk Operations ===

    @PostMapping("/bulk/enable")
    @Operation(summary = "Enable jobs", description = "Enable multiple jobs and push each to the scheduler")
    public ResponseEntity<ApiResponse<ResyncReport>> enableJobs(@Valid @RequestBody BulkJobRequest request) {
        log.info("API: Bulk enable {} jobs", request.getNames().size());

        var report = jobManagementService.setEnabled(request.getNames(), true);
        return ResponseEntity.ok(ApiResponse.success(report, String.format("Enabled %d jobs", report.getUpdated())));
    }

    @PostMapping("/bulk/disable")
    @Operation(summary = "Disable jobs", description = "Disable multiple jobs and push each to the scheduler")
    public ResponseEntity<ApiResponse<ResyncReport>> disableJobs(@Valid @RequestBody BulkJobRequest request) {
        log.info("API: Bulk disable {} jobs", request.getNames().size());

        var report = jobManagementService.setEnabled(request.getNames(), false);
        return ResponseEntity.ok(ApiResponse.success(report, String.format("Disabled %d jobs", report.getUpdated())));
    }

    // === Reconciliation ===

    @PostMapping("/resync")
    @Operation(summary = "Resync all jobs", description = "Push every job and delete orphaned jobs from the scheduler")
    public ResponseEntity<ApiResponse<ResyncReport>> resync() {
        log.info("API: Resync all jobs");

        var report = jobManagementService.resync();
        return ResponseEntity.ok(ApiResponse.success(report,
                String.format("%d updated and %d deleted", report.getUpdated(), report.getDeleted())));
    }

    private String savedMessage(String verb, JobResponse response) {
        if (response.getSyncError() != null) {
            return String.format("Job %s locally but the scheduler was not updated: %s", verb, response.getSyncError());
        }
        return "Job " + verb + " successfully";
    }
}
