package com.example.jobsync.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Slack destination for job failure notifications
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {

    /**
     * Incoming-webhook URL. Notifications are only logged while it is blank.
     */
    private String webhookUrl;

    /**
     * Channel receiving failed-run notifications posted by the webhook receiver.
     */
    @NotBlank
    private String channel = "#job-sync-failures";

    /**
     * Username shown on each message; the application name when unset.
     */
    private String username;

    private boolean enabled = true;

    public boolean canSend() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
