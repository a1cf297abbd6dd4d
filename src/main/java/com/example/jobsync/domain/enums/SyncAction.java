package com.example.jobsync.domain.enums;

/**
 * What a reconciliation pass did to a single job
 */
public enum SyncAction {

    /**
     * Local job pushed (created or replaced) to the scheduler
     */
    UPDATE,

    /**
     * Orphaned remote job removed from the scheduler
     */
    DELETE
}
