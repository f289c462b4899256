package com.anomalywatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the investigation engine.
 *
 * - investigationExecutor: runs investigators (one task per execution)
 * - resultWriterExecutor: stores findings, one transaction per finding
 * - notificationExecutor: publishes notifications to Kafka
 *
 * The notification pool has exactly one thread and a bounded FIFO queue:
 * events are published in the order they were produced, so Started always
 * precedes the ResultAdded events of the same execution.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    /**
     * Investigator runs. A full queue rejects the start request instead of
     * blocking the caller, which is an HTTP request thread.
     */
    @Bean(name = "investigationExecutor")
    public ThreadPoolTaskExecutor investigationExecutor(InvestigationProperties properties) {
        InvestigationProperties.Execution settings = properties.getExecution();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getRunnerThreads());
        executor.setMaxPoolSize(settings.getRunnerThreads());
        executor.setQueueCapacity(settings.getRunnerQueueCapacity());
        executor.setThreadNamePrefix("investigation-");
        executor.setRejectedExecutionHandler(new AbortWithLogging());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("Initialized investigation executor - Threads: {}, Queue: {}",
                settings.getRunnerThreads(), settings.getRunnerQueueCapacity());
        return executor;
    }

    /**
     * Finding writes. When saturated the investigator thread stores the finding
     * itself, which slows the scan down to the speed of the database.
     */
    @Bean(name = "resultWriterExecutor")
    public ThreadPoolTaskExecutor resultWriterExecutor(InvestigationProperties properties) {
        InvestigationProperties.Execution settings = properties.getExecution();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getWriterThreads());
        executor.setMaxPoolSize(settings.getWriterThreads());
        executor.setQueueCapacity(settings.getWriterQueueCapacity());
        executor.setThreadNamePrefix("result-writer-");
        executor.setRejectedExecutionHandler(new CallerRunsWithLogging());

        // Pending findings are still stored on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("Initialized result writer executor - Threads: {}, Queue: {}",
                settings.getWriterThreads(), settings.getWriterQueueCapacity());
        return executor;
    }

    /**
     * Notification dispatch. The bounded queue caps the backlog while the broker is
     * down; overflow is rejected and the notifier logs and drops the event.
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(InvestigationProperties properties) {
        int queueCapacity = properties.getNotifications().getQueueCapacity();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notification-");
        executor.setRejectedExecutionHandler(new AbortWithLogging());

        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("Initialized notification executor - Threads: 1, Queue: {}", queueCapacity);
        return executor;
    }

    /**
     * Runs the task in the caller thread when the pool is saturated.
     * After shutdown the task is rejected with an exception so callers never wait
     * on work that will not run.
     */
    @Slf4j
    static class CallerRunsWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                log.error("Executor shut down, task rejected: {}", r);
                throw new RejectedExecutionException("Executor has been shut down");
            }
            log.warn("Thread pool saturated, running task in caller thread - Pool: {}, Active: {}, Queue: {}",
                    executor.getPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size());
            r.run();
        }
    }

    @Slf4j
    static class AbortWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.error("Task rejected - Pool: {}, Active: {}, Queue: {}",
                    executor.getPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size());
            throw new RejectedExecutionException("Thread pool exhausted, cannot execute task");
        }
    }
}
