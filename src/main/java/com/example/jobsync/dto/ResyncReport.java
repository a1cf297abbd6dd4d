package com.example.jobsync.dto;

import com.example.jobsync.service.sync.SyncResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a reconciliation pass or a bulk push.
 * Failed items are listed individually; successes are only counted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResyncReport {

    private int updated;
    private int deleted;
    private List<SyncResult> errors;

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
