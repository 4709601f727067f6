package com.phillippitts.capturesync.service.upload;

import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.domain.TrackType;
import com.phillippitts.capturesync.domain.UploadKind;
import com.phillippitts.capturesync.domain.UploadTask;
import com.phillippitts.capturesync.service.ledger.SegmentLedgerReader;
import com.phillippitts.capturesync.service.metrics.UploadMetrics;
import com.phillippitts.capturesync.service.upload.event.TrackLoopFailedEvent;
import com.phillippitts.capturesync.service.upload.event.UploadFailedEvent;
import com.phillippitts.capturesync.util.LogSanitizer;
import com.phillippitts.capturesync.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Upload loop for one track of one session.
 *
 * <p><b>States:</b>
 * <pre>
 * Polling → Reconciling → (Polling | Draining) → Finished
 * </pre>
 * Each reconciliation pass reads the ledger, uploads every newly listed segment whose file exists
 * and waits for all uploads of that pass before sleeping again. Once the shutdown flag is observed,
 * the loop waits (bounded) for the capture-stopped signal so the recorder's final ledger entries are
 * on disk, then exactly one more pass runs (the drain) and the track's {@link TrackCompletion} is
 * marked finished.
 *
 * <p><b>At-most-once:</b> a name enters the seen-set the first time it is listed, whether or not its
 * file was on disk yet, and is never considered again. Upload failures are logged, counted and
 * published as {@link UploadFailedEvent}; they never abort the loop.
 *
 * <p><b>Thread Safety:</b> {@link #run()} must be executed by a single thread. The seen-set and
 * screenshot marker are confined to that thread; uploads run on the upload executor.
 */
public final class TrackUploadDispatcher implements Runnable {

    private static final Logger LOG = LogManager.getLogger(TrackUploadDispatcher.class);
    private static final int MAX_REASON_CHARS = 200;

    private final TrackType track;
    private final Path segmentDir;
    private final Path ledgerFile;
    private final Path screenshotFile;
    private final RecordingOptions options;
    private final SegmentLedgerReader ledgerReader;
    private final SegmentUploader uploader;
    private final Executor uploadExecutor;
    private final AtomicBoolean shutdownFlag;
    private final Future<Void> captureStopped;
    private final TrackCompletion completion;
    private final long pollIntervalMs;
    private final long captureStopWaitMs;
    private final long screenshotDelayMs;
    private final UploadMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private final Set<String> seen = new HashSet<>();
    private boolean screenshotUploaded;

    TrackUploadDispatcher(TrackType track,
                          Path segmentDir,
                          Path ledgerFile,
                          Path screenshotFile,
                          RecordingOptions options,
                          SegmentLedgerReader ledgerReader,
                          SegmentUploader uploader,
                          Executor uploadExecutor,
                          AtomicBoolean shutdownFlag,
                          Future<Void> captureStopped,
                          TrackCompletion completion,
                          long pollIntervalMs,
                          long captureStopWaitMs,
                          long screenshotDelayMs,
                          UploadMetrics metrics,
                          ApplicationEventPublisher publisher) {
        this.track = track;
        this.segmentDir = segmentDir;
        this.ledgerFile = ledgerFile;
        this.screenshotFile = screenshotFile;
        this.options = options;
        this.ledgerReader = ledgerReader;
        this.uploader = uploader;
        this.uploadExecutor = uploadExecutor;
        this.shutdownFlag = shutdownFlag;
        this.captureStopped = captureStopped;
        this.completion = completion;
        this.pollIntervalMs = pollIntervalMs;
        this.captureStopWaitMs = captureStopWaitMs;
        this.screenshotDelayMs = screenshotDelayMs;
        this.metrics = metrics;
        this.publisher = publisher;
    }

    @Override
    public void run() {
        ThreadContext.put("videoId", options.videoId());
        ThreadContext.put("track", track.label());
        LOG.info("Upload loop started (ledger={})", ledgerFile);
        try {
            boolean draining = false;
            boolean interrupted = false;
            while (true) {
                if (!draining && shutdownFlag.get()) {
                    draining = true;
                    interrupted = !awaitCaptureStopped();
                }
                reconcile(draining);
                if (draining) {
                    break;
                }
                if (!TimeUtils.sleepQuietly(pollIntervalMs)) {
                    LOG.warn("Upload loop interrupted; running drain pass now");
                    // cleared for the drain pass: interruptible file channels refuse to read otherwise
                    interrupted = Thread.interrupted();
                    draining = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            if (completion.markFinished()) {
                LOG.info("Upload loop drained and finished ({} segments seen)", seen.size());
            }
        } catch (RuntimeException e) {
            LOG.error("Upload loop terminated without draining: {}", e.getMessage(), e);
            completion.markFailed(e);
            publisher.publishEvent(new TrackLoopFailedEvent(options.videoId(), track, e.getMessage(), Instant.now()));
            throw e;
        } finally {
            ThreadContext.remove("videoId");
            ThreadContext.remove("track");
        }
    }

    /**
     * Waits for the recorder to finish its final flush before the drain pass reads the ledger.
     *
     * @return {@code false} if interrupted while waiting; the interrupt flag is left cleared
     */
    private boolean awaitCaptureStopped() {
        try {
            captureStopped.get(captureStopWaitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Capture not stopped after {} ms; draining the ledger as it stands", captureStopWaitMs);
        } catch (ExecutionException e) {
            LOG.warn("Capture stop failed ({}); draining the ledger as it stands", e.getCause().getMessage());
        } catch (InterruptedException e) {
            LOG.warn("Interrupted waiting for capture to stop; running drain pass now");
            return false;
        }
        return true;
    }

    /**
     * Runs one reconciliation pass and waits for every upload it issued.
     *
     * @param drain whether this is the final pass after shutdown
     * @return number of uploads issued by this pass
     * @throws com.phillippitts.capturesync.exception.LedgerReadException if the ledger cannot be read
     */
    int reconcile(boolean drain) {
        metrics.incrementPass(track, drain);
        Set<String> fresh = ledgerReader.read(ledgerFile);
        fresh.removeAll(seen);

        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (String name : fresh) {
            Path segment = segmentDir.resolve(name).normalize();
            if (!segment.startsWith(segmentDir.normalize())) {
                LOG.warn("Ignoring ledger entry outside the segment directory: {}", name);
            } else if (Files.isRegularFile(segment)) {
                pending.add(submit(new UploadTask(segment, track, UploadKind.SEGMENT), 0));
            } else {
                LOG.debug("Segment {} listed before its file exists; it will not be retried", name);
            }
            seen.add(name);
        }

        if (screenshotFile != null && !screenshotUploaded && Files.isRegularFile(screenshotFile)) {
            pending.add(submit(new UploadTask(screenshotFile, track, UploadKind.SCREENSHOT), screenshotDelayMs));
            screenshotUploaded = true;
        }

        if (!pending.isEmpty()) {
            LOG.debug("Pass issued {} uploads (drain={})", pending.size(), drain);
            CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new)).join();
        }
        return pending.size();
    }

    private CompletableFuture<Void> submit(UploadTask task, long delayMs) {
        return CompletableFuture.runAsync(() -> upload(task, delayMs), uploadExecutor);
    }

    private void upload(UploadTask task, long delayMs) {
        boolean interrupted = delayMs > 0 && !TimeUtils.sleepQuietly(delayMs);
        if (interrupted) {
            // cleared for the transfer: interruptible file channels refuse to read otherwise
            Thread.interrupted();
            LOG.debug("Delay before {} upload interrupted; uploading now", task.fileName());
        }
        long t0 = System.nanoTime();
        try {
            LOG.info("Uploading {} for {}: {}", task.kind(), track.label(), task.fileName());
            uploader.upload(options, task.file(), task.uploadLabel());
            metrics.incrementSuccess(track, task.kind());
            LOG.debug("Uploaded {} in {} ms", task.fileName(), TimeUtils.elapsedMillis(t0));
        } catch (RuntimeException e) {
            metrics.incrementFailure(track, task.kind());
            LOG.warn("Upload of {} failed and will not be retried: {}", task.fileName(), e.getMessage());
            publisher.publishEvent(new UploadFailedEvent(options.videoId(), track, task.kind(),
                    task.fileName(), LogSanitizer.truncate(e.getMessage(), MAX_REASON_CHARS), Instant.now()));
        } finally {
            metrics.recordLatency(track, task.kind(), System.nanoTime() - t0);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public TrackType track() {
        return track;
    }

    public TrackCompletion completion() {
        return completion;
    }

    /** Visible for tests */
    Set<String> seenSegments() {
        return Collections.unmodifiableSet(new HashSet<>(seen));
    }

    /** Visible for tests */
    boolean isScreenshotUploaded() {
        return screenshotUploaded;
    }
}
