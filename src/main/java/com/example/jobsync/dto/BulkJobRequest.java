package com.example.jobsync.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request for bulk operations
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkJobRequest {

    @NotEmpty(message = "Job names are required")
    @Size(max = 100, message = "Maximum 100 jobs per batch")
    private List<String> names;
}
