package com.example.jobsync.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255)
    @Pattern(regexp = "^[A-Za-z0-9_-]+$", message = "Name may only contain letters, digits, '-' and '_'")
    private String name;

    /**
     * Cron expression, preset (@daily, @every 1h, @manually, ...) or "@parent JOBNAME"
     */
    @NotBlank(message = "Schedule is required")
    @Size(max = 255)
    private String schedule;

    @NotBlank(message = "Command is required")
    @Size(max = 255)
    private String command;

    @Size(max = 255)
    private String description;

    @Builder.Default
    private boolean enabled = true;

    private boolean useShell;

    @Builder.Default
    private boolean notifyOnError = true;

    @Min(0)
    private int retries;
}
