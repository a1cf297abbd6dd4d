package com.example.jobsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Job Sync Service Application
 * <p>
 * Control-plane adapter that owns job definitions in a relational store and mirrors
 * them into an external clustered job scheduler over its HTTP API.
 * <p>
 * Features:
 * - Dependency-ordered full reconciliation of local jobs against the scheduler
 * - Namespace isolation for scheduler instances shared by several deployments
 * - Execution-result webhook with Slack notification on failure
 * - Distributed lock around scheduled reconciliation passes
 */
@EnableScheduling
@SpringBootApplication
public class JobSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobSyncApplication.class, args);
    }
}
