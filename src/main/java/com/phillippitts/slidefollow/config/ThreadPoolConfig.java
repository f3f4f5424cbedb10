package com.phillippitts.slidefollow.config;

import com.phillippitts.slidefollow.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for the follow loop and for reconnect delays.
 *
 * <p>Queue size and thread names are configured via {@link ThreadPoolProperties}.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single-threaded executor that evaluates final transcripts in arrival order.
     *
     * <p>Core and max size are fixed at one: the follow loop is the only writer of follow state.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the queue is full the transport thread evaluates the transcript itself, so no final is
     * dropped and recognition is slowed down instead.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the submitting thread to the worker.
     *
     * @return follow loop executor
     */
    @Bean(name = "followLoopExecutor")
    public ThreadPoolTaskExecutor followLoopExecutor() {
        ThreadPoolProperties.FollowPoolProperties followProps = threadPoolProperties.getFollow();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(followProps.getQueueCapacity());
        executor.setThreadNamePrefix(followProps.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for recognition and sync reconnect delays.
     *
     * @return reconnect scheduler
     */
    @Bean(name = "reconnectScheduler")
    public ThreadPoolTaskScheduler reconnectScheduler() {
        ThreadPoolProperties.ReconnectPoolProperties reconnectProps = threadPoolProperties.getReconnect();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(reconnectProps.getPoolSize());
        scheduler.setThreadNamePrefix(reconnectProps.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    static TaskDecorator threadContextPropagation() {
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
