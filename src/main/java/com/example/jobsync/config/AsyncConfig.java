package com.example.jobsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async processing.
 * <p>
 * Only outbound notifications run asynchronously; reconciliation and webhook
 * handling stay on the calling thread.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Value("${job-sync.notifier-pool-size:4}")
    private int notifierPoolSize;

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring notification executor with {} threads", notifierPoolSize);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notifierPoolSize);
        executor.setMaxPoolSize(notifierPoolSize * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Notification rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }
}
