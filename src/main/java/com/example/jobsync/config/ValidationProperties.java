package com.example.jobsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "job-sync.validation")
public class ValidationProperties {

    /**
     * Push a disabled throwaway job to let the scheduler parse the schedule before saving
     */
    private boolean probeSchedule = false;
}
