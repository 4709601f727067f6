package com.phillippitts.capturesync.config.session;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Configuration properties for recording sessions and the upload loops.
 *
 * <p>Example application.properties:
 * <pre>
 * capture.session.data-dir=${user.home}/.capturesync
 * capture.session.poll-interval-ms=100
 * capture.session.drain-timeout-ms=300000
 * capture.session.capture-stop-wait-ms=30000
 * capture.session.screenshot-upload-delay-ms=1000
 * </pre>
 */
@ConfigurationProperties(prefix = "capture.session")
@Validated
public class SessionProperties {

    /** Root under which chunks/video, chunks/audio and screenshots live. Start fails when unset. */
    private String dataDir;

    /** Sleep between ledger reconciliation passes. */
    @Min(value = 10, message = "Poll interval must be at least 10 ms")
    @Max(value = 10_000, message = "Poll interval must be at most 10 s")
    private long pollIntervalMs = 100;

    /** Upper bound on stop's wait for both tracks to drain. */
    @Min(value = 1_000, message = "Drain timeout must be at least 1 s")
    private long drainTimeoutMs = 300_000;

    /** Upper bound on an upload loop's wait for the recorder's final flush before its drain pass. */
    @PositiveOrZero(message = "Capture stop wait must not be negative")
    private long captureStopWaitMs = 30_000;

    /** Delay before the screenshot upload so the recorder can finish writing the JPEG. */
    @PositiveOrZero(message = "Screenshot upload delay must not be negative")
    private long screenshotUploadDelayMs = 1_000;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    /** Data root as a path, empty when not configured. */
    public Optional<Path> dataRoot() {
        return (dataDir == null || dataDir.isBlank()) ? Optional.empty() : Optional.of(Path.of(dataDir));
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public Duration drainTimeout() {
        return Duration.ofMillis(drainTimeoutMs);
    }

    public long getCaptureStopWaitMs() {
        return captureStopWaitMs;
    }

    public void setCaptureStopWaitMs(long captureStopWaitMs) {
        this.captureStopWaitMs = captureStopWaitMs;
    }

    public long getScreenshotUploadDelayMs() {
        return screenshotUploadDelayMs;
    }

    public void setScreenshotUploadDelayMs(long screenshotUploadDelayMs) {
        this.screenshotUploadDelayMs = screenshotUploadDelayMs;
    }
}
