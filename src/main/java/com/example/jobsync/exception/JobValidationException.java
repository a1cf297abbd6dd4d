package com.example.jobsync.exception;

import lombok.Getter;

/**
 * A job definition failed local checks before any network call was made
 */
@Getter
public class JobValidationException extends RuntimeException {

    private final String field;

    public JobValidationException(String field, String message) {
        super(String.format("%s: %s", field, message));
        this.field = field;
    }
}
