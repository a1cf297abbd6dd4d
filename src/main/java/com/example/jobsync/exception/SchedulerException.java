package com.example.jobsync.exception;

/**
 * Base class for failures talking to the external scheduler.
 * <p>
 * Callers that only need to know "the push did not happen" catch this; callers that
 * react differently to an unreachable scheduler catch the subclasses.
 */
public abstract class SchedulerException extends RuntimeException {

    protected SchedulerException(String message) {
        super(message);
    }

    protected SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
