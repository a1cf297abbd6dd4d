package com.example.jobsync.controller;

import com.example.jobsync.config.MetricsConfig;
import com.example.jobsync.exception.WebhookRejectedException;
import com.example.jobsync.service.webhook.WebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Receives execution results posted by the scheduler's shell processor.
 * <p>
 * Mapped for every HTTP method so that a wrong method gets a 400 rather than the
 * framework's 405, and only after the disabled check. The body is read straight from the
 * servlet stream as UTF-8 whatever the Content-Type, so form-encoded posts are not turned
 * into request parameters.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Scheduler Webhook", description = "Execution callbacks from the scheduler")
public class WebhookController {

    private final WebhookService webhookService;
    private final MetricsConfig metricsConfig;

    @RequestMapping("/api/v1/scheduler/webhook")
    @Operation(summary = "Record a job execution", description = "Plain-text body: token, job name, success flag")
    public ResponseEntity<Void> receive(HttpServletRequest request) {
        try {
            webhookService.ensureEnabled();
            if (!"POST".equals(request.getMethod())) {
                throw new WebhookRejectedException(HttpStatus.BAD_REQUEST, "Method not allowed: " + request.getMethod());
            }

            var baseUrl = ServletUriComponentsBuilder.fromRequestUri(request).replacePath(null).toUriString();
            webhookService.apply(readBody(request), baseUrl);
            metricsConfig.recordWebhook(HttpStatus.OK.value());
            return ResponseEntity.ok().build();
        } catch (WebhookRejectedException e) {
            metricsConfig.recordWebhook(e.getStatus().value());
            throw e;
        }
    }

    private String readBody(HttpServletRequest request) {
        try {
            return StreamUtils.copyToString(request.getInputStream(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read webhook body: {}", e.getMessage());
            throw new WebhookRejectedException(HttpStatus.BAD_REQUEST, "Unreadable body");
        }
    }
}
