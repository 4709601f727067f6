package com.phillippitts.capturesync.service.metrics;

import com.phillippitts.capturesync.domain.TrackType;
import com.phillippitts.capturesync.domain.UploadKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for the segment upload pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Upload latency per track and kind</li>
 *   <li>Upload success/failure counts per track and kind</li>
 *   <li>Reconciliation passes per track</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class UploadMetrics {

    private static final String METRIC_PREFIX = "capturesync.upload";

    private final MeterRegistry registry;

    public UploadMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one upload attempt, successful or not.
     */
    public void recordLatency(TrackType track, UploadKind kind, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to upload one file")
                .tag("track", track.label())
                .tag("kind", tagValue(kind))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(TrackType track, UploadKind kind) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful uploads")
                .tag("track", track.label())
                .tag("kind", tagValue(kind))
                .register(registry)
                .increment();
    }

    public void incrementFailure(TrackType track, UploadKind kind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed uploads (never retried)")
                .tag("track", track.label())
                .tag("kind", tagValue(kind))
                .register(registry)
                .increment();
    }

    /**
     * Counts a reconciliation pass.
     *
     * @param track track that ran the pass
     * @param drain whether this was the final pass after shutdown
     */
    public void incrementPass(TrackType track, boolean drain) {
        Counter.builder(METRIC_PREFIX + ".passes")
                .description("Number of ledger reconciliation passes")
                .tag("track", track.label())
                .tag("drain", Boolean.toString(drain))
                .register(registry)
                .increment();
    }

    private static String tagValue(UploadKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
