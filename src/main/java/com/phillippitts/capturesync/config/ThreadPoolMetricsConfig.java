package com.phillippitts.capturesync.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the upload executor through Micrometer:
 * <ul>
 *   <li>upload.pool.size - current number of threads</li>
 *   <li>upload.pool.active - threads executing an upload</li>
 *   <li>upload.pool.queued - uploads waiting in the queue</li>
 *   <li>upload.pool.completed - cumulative completed uploads</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> uploadExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("uploadExecutor") ObjectProvider<ThreadPoolTaskExecutor> uploadExecutorProvider) {
        this.uploadExecutorProvider = uploadExecutorProvider;
    }

    @Bean
    public MeterBinder uploadExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = uploadExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("upload.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the upload pool")
                    .register(registry);
            Gauge.builder("upload.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively uploading")
                    .register(registry);
            Gauge.builder("upload.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of uploads waiting in the queue")
                    .register(registry);
            Gauge.builder("upload.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed uploads")
                    .register(registry);

            LOG.info("Upload thread pool metrics registered: upload.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = uploadExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Upload Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
