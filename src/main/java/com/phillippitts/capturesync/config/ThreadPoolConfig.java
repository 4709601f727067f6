package com.phillippitts.capturesync.config;

import com.phillippitts.capturesync.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for the upload pipeline.
 *
 * <p>The dispatcher pool runs the per-track upload loops, which live for the whole session, so a
 * rejected loop must fail the start instead of running on the caller ({@link ThreadPoolExecutor.AbortPolicy}).
 * The upload pool runs individual uploads and uses {@link ThreadPoolExecutor.CallerRunsPolicy}: when
 * pool and queue are full, the dispatcher thread uploads the file itself, providing backpressure.
 *
 * <p>Both pools copy the Log4j2 ThreadContext from the submitting thread so videoId/track
 * correlation survives the hop.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "dispatcherExecutor")
    public ThreadPoolTaskExecutor dispatcherExecutor() {
        return build(threadPoolProperties.getDispatcher(), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "uploadExecutor")
    public ThreadPoolTaskExecutor uploadExecutor() {
        return build(threadPoolProperties.getUpload(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Runs start calls made over HTTP. A second thread lets a conflicting start fail fast
     * instead of queueing behind the active session.
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        return build(threadPoolProperties.getSession(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext into the worker and restores the worker's own afterwards.
     */
    static TaskDecorator mdcPropagating() {
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
