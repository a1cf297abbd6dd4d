package com.example.jobsync.exception;

/**
 * The scheduler answered with the expected status but a body that could not be decoded.
 * The scheduler is reachable, so this does not count against the circuit breaker.
 */
public class SchedulerResponseException extends SchedulerException {

    public SchedulerResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
