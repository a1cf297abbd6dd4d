package com.example.jobsync.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for the external scheduler API.
 * <p>
 * The API base URL and the basic auth header are computed once here from static
 * configuration and baked into the client.
 */
@Slf4j
@Configuration
public class WebClientConfig {

    private static final String SERVICE_NAME = "Scheduler";

    @Bean(name = "schedulerWebClient")
    public WebClient schedulerWebClient(WebClient.Builder builder, SchedulerProperties properties) {
        var timeoutSeconds = properties.getTimeoutSeconds();
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        log.info("Configuring scheduler client for {} (auth: {}, timeout: {}s)",
                properties.getApiUrl(), properties.getApiAuth() != null && !properties.getApiAuth().isBlank(), timeoutSeconds);

        var clientBuilder = builder.clone()
                .baseUrl(properties.getApiUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(logRequest())
                .filter(logResponse());

        if (properties.getApiAuth() != null && !properties.getApiAuth().isBlank()) {
            clientBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + properties.getApiAuth());
        }

        return clientBuilder.build();
    }

    /**
     * Log outgoing requests
     */
    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", SERVICE_NAME, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    /**
     * Log incoming responses
     */
    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", SERVICE_NAME, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", SERVICE_NAME, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
