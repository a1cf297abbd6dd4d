package com.example.jobsync.exception;

import lombok.Getter;

/**
 * The scheduler answered with a non-success HTTP status.
 * The response body is kept verbatim so it can be shown to an operator.
 */
@Getter
public class SchedulerRejectedException extends SchedulerException {

    private final int statusCode;
    private final String responseBody;

    public SchedulerRejectedException(int statusCode, String responseBody) {
        super(String.format("HTTP %d: %s", statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }
}
