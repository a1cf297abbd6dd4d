package com.example.jobsync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and tenancy settings for the external job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-sync.scheduler")
public class SchedulerProperties {

    /**
     * Root URL of the scheduler, e.g. http://scheduler:8080 (the API lives under /v1)
     */
    @NotBlank
    private String url;

    /**
     * Path (or absolute URL) where the scheduler dashboard is exposed to users
     */
    private String dashboardPath = "/scheduler/ui/";

    /**
     * Pre-encoded basic auth token sent as "Authorization: Basic ..." when set
     */
    private String apiAuth;

    /**
     * Prefix isolating this deployment's jobs in a shared scheduler instance
     */
    private String namespace;

    /**
     * Agent label jobs are routed to; also scopes which remote jobs are considered ours
     */
    private String jobLabel;

    /**
     * Connect/read/response timeout for every scheduler call
     */
    @Min(1)
    private int timeoutSeconds = 30;

    /**
     * API base URL, without trailing slash
     */
    public String getApiUrl() {
        var root = url == null ? "" : url.replaceAll("/+$", "");
        return root + "/v1";
    }

    public boolean hasJobLabel() {
        return jobLabel != null && !jobLabel.isBlank();
    }
}
