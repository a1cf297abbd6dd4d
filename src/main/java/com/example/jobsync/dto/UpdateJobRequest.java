package com.example.jobsync.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for updating a job. Null fields are left unchanged.
 * The name is immutable once created since other jobs may reference it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateJobRequest {

    @Size(max = 255)
    private String schedule;

    @Size(max = 255)
    private String command;

    @Size(max = 255)
    private String description;

    private Boolean enabled;
    private Boolean useShell;
    private Boolean notifyOnError;

    @Min(0)
    private Integer retries;
}
