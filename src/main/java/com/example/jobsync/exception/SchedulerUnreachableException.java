package com.example.jobsync.exception;

/**
 * Network-level failure reaching the scheduler (connection refused, timeout,
 * circuit breaker open).
 */
public class SchedulerUnreachableException extends SchedulerException {

    public SchedulerUnreachableException(String message) {
        super(message);
    }

    public SchedulerUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
