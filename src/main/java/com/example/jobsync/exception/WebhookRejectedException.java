package com.example.jobsync.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Malformed, unauthorized or unknown-target webhook delivery.
 * Always a client error, never a server fault.
 */
@Getter
public class WebhookRejectedException extends RuntimeException {

    private final HttpStatus status;

    public WebhookRejectedException(HttpStatus status, String reason) {
        super(reason);
        this.status = status;
    }
}
