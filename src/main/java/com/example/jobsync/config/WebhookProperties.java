package com.example.jobsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Execution-result webhook configuration
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "job-sync.webhook")
public class WebhookProperties {

    /**
     * Shared secret expected on the first line of every callback.
     * When unset the webhook endpoint answers 404.
     */
    private String token;

    public boolean isEnabled() {
        return token != null;
    }
}
