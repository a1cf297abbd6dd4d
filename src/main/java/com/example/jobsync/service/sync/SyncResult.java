package com.example.jobsync.service.sync;

import com.example.jobsync.domain.enums.SyncAction;
import lombok.Value;

/**
 * Outcome for one job within a reconciliation pass
 */
@Value
public class SyncResult {

    /**
     * Local (un-namespaced) job name
     */
    String jobName;

    SyncAction action;

    /**
     * Failure description, null on success
     */
    String error;

    public static SyncResult updated(String jobName) {
        return new SyncResult(jobName, SyncAction.UPDATE, null);
    }

    public static SyncResult updateFailed(String jobName, String error) {
        return new SyncResult(jobName, SyncAction.UPDATE, error);
    }

    public static SyncResult deleted(String jobName) {
        return new SyncResult(jobName, SyncAction.DELETE, null);
    }

    public static SyncResult deleteFailed(String jobName, String error) {
        return new SyncResult(jobName, SyncAction.DELETE, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
