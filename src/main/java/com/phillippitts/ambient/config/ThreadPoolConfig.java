package com.phillippitts.ambient.config;

import com.phillippitts.ambient.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind sensing, command execution and event offload.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 *
 * <p>All executors use {@link ThreadPoolExecutor.CallerRunsPolicy}: when the pool and queue are
 * full the submitting thread runs the task, providing backpressure instead of dropping work.
 * Log4j2 ThreadContext (MDC) is copied from the submitting thread to the worker thread so
 * request and command correlation IDs survive the hand-off.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Scheduler for periodic screen sampling. Also picked up by {@code @EnableScheduling}.
     *
     * @return scheduler named {@code sentinel-N}
     */
    @Bean(name = "sentinelScheduler")
    public ThreadPoolTaskScheduler sentinelScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Executor for command routing and action handlers, including commands issued by
     * context triggers. Keeps sentinel threads from blocking on command execution.
     *
     * @return configured executor ({@code threadpool.command.*})
     */
    @Bean(name = "commandExecutor")
    public Executor commandExecutor() {
        return buildExecutor(threadPoolProperties.getCommand());
    }

    /**
     * Executor for clarifier round-trips. Kept separate so a slow completion backend cannot
     * starve command execution; callers bound each call with a timeout.
     *
     * @return configured executor ({@code threadpool.clarifier.*})
     */
    @Bean(name = "clarifierExecutor")
    public Executor clarifierExecutor() {
        return buildExecutor(threadPoolProperties.getClarifier());
    }

    /**
     * Bounded pool for event listener offload.
     *
     * @return configured executor ({@code threadpool.event.*})
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        return buildExecutor(threadPoolProperties.getEvent());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    // Package-private for tests
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
