package com.example.jobsync.client;

import com.example.jobsync.client.ClientModels.SchedulerJob;
import com.example.jobsync.config.SchedulerProperties;
import com.example.jobsync.exception.SchedulerException;
import com.example.jobsync.exception.SchedulerRejectedException;
import com.example.jobsync.exception.SchedulerResponseException;
import com.example.jobsync.exception.SchedulerUnreachableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Client for the external scheduler's job API.
 * <p>
 * Uses:
 * - WebClient with connect/read timeouts from {@link SchedulerProperties}
 * - Resilience4j Circuit Breaker that opens on network failures only
 * <p>
 * A non-success status surfaces as {@link SchedulerRejectedException} carrying the raw
 * body; a connection failure or timeout surfaces as {@link SchedulerUnreachableException};
 * an expected status with an undecodable body surfaces as
 * {@link SchedulerResponseException}. Nothing is retried here.
 */
@Slf4j
@Component
public class SchedulerClient {

    private static final String CIRCUIT_BREAKER = "scheduler";
    private static final ParameterizedTypeReference<List<SchedulerJob>> JOB_LIST = new ParameterizedTypeReference<>() {
    };

    private final WebClient webClient;
    private final Duration timeout;

    public SchedulerClient(@Qualifier("schedulerWebClient") WebClient webClient, SchedulerProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    /**
     * List every job carrying this service's ownership marker
     *
     * @throws SchedulerRejectedException if the scheduler does not answer 200
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "listOwnedJobsFallback")
    public List<SchedulerJob> listOwnedJobs() {
        log.debug("Listing owned jobs from scheduler");

        try {
            return webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/jobs")
                            .queryParam("metadata[" + ClientModels.OWNER_METADATA_KEY + "]", ClientModels.OWNER_METADATA_VALUE)
                            .build())
                    .exchangeToMono(response -> response.statusCode().value() == HttpStatus.OK.value()
                            ? response.bodyToMono(JOB_LIST).defaultIfEmpty(List.of())
                            : SchedulerClient.<List<SchedulerJob>>rejected(response))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw translate("Listing jobs failed", e);
        }
    }

    /**
     * Fetch the current remote representation of a job
     *
     * @return the job, or empty when the scheduler does not know it
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "getJobFallback")
    public Optional<SchedulerJob> getJob(String wireName) {
        log.debug("Fetching job {} from scheduler", wireName);

        try {
            return webClient.get()
                    .uri("/jobs/{name}", wireName)
                    .exchangeToMono(response -> {
                        var status = response.statusCode().value();
                        if (status == HttpStatus.OK.value()) {
                            return response.bodyToMono(SchedulerJob.class);
                        }
                        if (status == HttpStatus.NOT_FOUND.value()) {
                            return response.releaseBody().then(Mono.<SchedulerJob>empty());
                        }
                        return SchedulerClient.<SchedulerJob>rejected(response);
                    })
                    .timeout(timeout)
                    .blockOptional();
        } catch (RuntimeException e) {
            throw translate("Fetching job " + wireName + " failed", e);
        }
    }

    /**
     * Create the job, or replace it entirely if the name already exists
     *
     * @throws SchedulerRejectedException unless the scheduler answers 201
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "createOrUpdateFallback")
    public void createOrUpdate(SchedulerJob job) {
        log.info("Pushing job {} to scheduler", job.getName());

        try {
            webClient.post()
                    .uri("/jobs")
                    .bodyValue(job)
                    .exchangeToMono(response -> response.statusCode().value() == HttpStatus.CREATED.value()
                            ? response.releaseBody()
                            : SchedulerClient.<Void>rejected(response))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw translate("Pushing job " + job.getName() + " failed", e);
        }
    }

    /**
     * Delete a job by its wire name
     *
     * @throws SchedulerRejectedException unless the scheduler answers 200
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "deleteJobFallback")
    public void deleteJob(String wireName) {
        log.info("Deleting job {} from scheduler", wireName);

        try {
            webClient.delete()
                    .uri("/jobs/{name}", wireName)
                    .exchangeToMono(response -> response.statusCode().value() == HttpStatus.OK.value()
                            ? response.releaseBody()
                            : SchedulerClient.<Void>rejected(response))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw translate("Deleting job " + wireName + " failed", e);
        }
    }

    /**
     * Sort a failed call into rejected, unreachable or undecodable.
     * Only network failures and timeouts are reported as unreachable.
     */
    private SchedulerException translate(String failure, RuntimeException e) {
        var cause = Exceptions.unwrap(e);
        if (cause instanceof SchedulerRejectedException rejected) {
            return rejected;
        }
        if (!(cause instanceof CodecException) && isNetworkFailure(cause)) {
            log.error("{}: scheduler unreachable: {}", failure, cause.getMessage());
            return new SchedulerUnreachableException(failure + ": " + cause.getMessage(), cause);
        }
        log.error("{}: unusable scheduler response: {}", failure, cause.getMessage());
        return new SchedulerResponseException(failure + ": unusable response: " + cause.getMessage(), cause);
    }

    private static boolean isNetworkFailure(Throwable error) {
        for (var current = error; current != null; current = current.getCause()) {
            if (current instanceof WebClientRequestException
                    || current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException
                    || current instanceof IOException) {
                return true;
            }
        }
        return false;
    }

    private static <T> Mono<T> rejected(ClientResponse response) {
        var status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.<T>error(new SchedulerRejectedException(status, body)));
    }

    // === Circuit breaker fallbacks, only reached while the breaker is open ===

    @SuppressWarnings("unused")
    private List<SchedulerJob> listOwnedJobsFallback(CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    @SuppressWarnings("unused")
    private Optional<SchedulerJob> getJobFallback(String wireName, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    @SuppressWarnings("unused")
    private void createOrUpdateFallback(SchedulerJob job, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    @SuppressWarnings("unused")
    private void deleteJobFallback(String wireName, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private SchedulerUnreachableException circuitOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open for scheduler: {}", e.getMessage());
        return new SchedulerUnreachableException("Scheduler temporarily unavailable (circuit breaker open)", e);
    }
}
