package com.example.jobsync.exception;

import lombok.Getter;

/**
 * Exception for duplicate job
 */
@Getter
public class DuplicateJobException extends RuntimeException {

    private final String jobName;

    public DuplicateJobException(String jobName) {
        super("Job already exists: " + jobName);
        this.jobName = jobName;
    }
}
