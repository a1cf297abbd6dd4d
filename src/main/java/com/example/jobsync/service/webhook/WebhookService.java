package com.example.jobsync.service.webhook;

import com.example.jobsync.config.WebhookProperties;
import com.example.jobsync.domain.entity.Job;
import com.example.jobsync.domain.repository.JobRepository;
import com.example.jobsync.exception.WebhookRejectedException;
import com.example.jobsync.service.alert.Notifier;
import com.example.jobsync.service.namespace.DashboardLinks;
import com.example.jobsync.service.namespace.NamespaceCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Applies execution-result callbacks from the scheduler to local job state.
 * <p>
 * The payload is three lines: shared secret, wire job name, {@code "true"} on success
 * (anything else is a failure). Deliveries are at-least-once; re-applying one just
 * rewrites the same fields, and a duplicate failure sends a duplicate notification.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookService {

    public static final String FAILED_JOB_EVENT = "job_sync_failed_job";

    private final WebhookProperties webhookProperties;
    private final JobRepository jobRepository;
    private final NamespaceCodec namespaceCodec;
    private final DashboardLinks dashboardLinks;
    private final Notifier notifier;

    /**
     * @throws WebhookRejectedException 404 when no shared secret is configured
     */
    public void ensureEnabled() {
        if (!webhookProperties.isEnabled()) {
            throw new WebhookRejectedException(HttpStatus.NOT_FOUND, "Webhook disabled");
        }
    }

    /**
     * Validate and apply one callback.
     *
     * @param body    raw request body
     * @param baseUrl base URL of the incoming request, used to make the dashboard link absolute
     * @return the updated job
     * @throws WebhookRejectedException 400 malformed, 403 bad secret, 404 disabled or unknown job
     */
    @Transactional
    public Job apply(String body, String baseUrl) {
        ensureEnabled();

        var lines = (body == null ? "" : body).lines().toList();
        if (lines.size() != 3) {
            throw new WebhookRejectedException(HttpStatus.BAD_REQUEST, "Expected 3 lines, got " + lines.size());
        }

        if (!lines.get(0).equals(webhookProperties.getToken())) {
            log.warn("Webhook rejected: invalid token");
            throw new WebhookRejectedException(HttpStatus.FORBIDDEN, "Invalid token");
        }

        var name = namespaceCodec.trimNamespace(lines.get(1));
        var job = name.isEmpty() ? null : jobRepository.findByName(name).orElse(null);
        if (job == null) {
            log.warn("Webhook rejected: unknown job {}", lines.get(1));
            throw new WebhookRejectedException(HttpStatus.NOT_FOUND, "Unknown job " + lines.get(1));
        }

        var success = "true".equals(lines.get(2));
        job.setLastRunSuccess(success);
        job.setLastRunDate(Instant.now());
        job = jobRepository.save(job);
        log.info("Recorded {} run for job {}", success ? "successful" : "failed", job.getName());

        if (!success && job.isNotifyOnError()) {
            notifier.notify(FAILED_JOB_EVENT, String.format(":red-pipeline: job *%s* <%s|failed>",
                    job.getName(), dashboardLinks.absoluteExecutions(baseUrl, job.getName())));
        }

        return job;
    }
}
