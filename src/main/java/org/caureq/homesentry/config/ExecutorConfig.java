package org.caureq.homesentry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for blocking collector I/O and webhook delivery, plus the wall clock
 * every time-window decision is evaluated against.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Collectors run here so a slow probe never blocks the scheduler thread.
     * Bounded queue; when saturated the submission is rejected and that collector is
     * counted as failed for the tick, so a pile of hung probes never lands on the scheduler thread.
     */
    @Bean(name = "collectorExecutor")
    public ThreadPoolTaskExecutor collectorExecutor(HomeSentryProps props) {
        Integer n = props.schedulerOrEmpty().workerThreads();
        int threads = n == null || n <= 0 ? 4 : n;

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("collector-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("webhook-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }
}
