package com.example.jobsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for job data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private Long id;
    private String name;
    private String schedule;
    private String parentName;
    private String command;
    private String description;
    private boolean enabled;
    private boolean useShell;
    private boolean notifyOnError;
    private int retries;
    private Instant lastRunDate;
    private Boolean lastRunSuccess;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Name of the job as seen by the scheduler
     */
    private String wireName;

    /**
     * Dashboard page listing this job's executions
     */
    private String executionsUrl;

    /**
     * Set when the local write succeeded but pushing it to the scheduler failed
     */
    private String syncError;
}
