package com.phillippitts.capturesync.service.orchestration;

import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.domain.SessionPaths;
import com.phillippitts.capturesync.domain.SessionStatus;
import com.phillippitts.capturesync.domain.TrackType;
import com.phillippitts.capturesync.service.capture.Recorder;
import com.phillippitts.capturesync.service.upload.TrackCompletion;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared state of one recording session.
 *
 * <p>The shutdown flag goes false to true exactly once. Each track's {@link TrackCompletion} is
 * completed once by that track's dispatcher. The recorder sits in a single slot: start deposits it,
 * and whoever stops the session takes it out, so it is stopped at most once. Whoever takes it out
 * also completes the capture-stopped signal, which the upload loops wait on before draining.
 */
final class ActiveSession {

    private final RecordingOptions options;
    private final SessionPaths paths;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicReference<Recorder> recorder = new AtomicReference<>();
    private final CompletableFuture<Void> captureStopped = new CompletableFuture<>();
    private final Map<TrackType, TrackCompletion> completions = new EnumMap<>(TrackType.class);

    ActiveSession(RecordingOptions options, SessionPaths paths) {
        this.options = Objects.requireNonNull(options, "options");
        this.paths = Objects.requireNonNull(paths, "paths");
        for (TrackType track : TrackType.values()) {
            completions.put(track, new TrackCompletion(track));
        }
    }

    RecordingOptions options() {
        return options;
    }

    SessionPaths paths() {
        return paths;
    }

    String videoId() {
        return options.videoId();
    }

    AtomicBoolean shutdownFlag() {
        return shutdown;
    }

    /**
     * @return {@code true} if this call flipped the flag
     */
    boolean requestShutdown() {
        return shutdown.compareAndSet(false, true);
    }

    boolean isShutdownRequested() {
        return shutdown.get();
    }

    TrackCompletion completion(TrackType track) {
        return completions.get(track);
    }

    void depositRecorder(Recorder started) {
        if (!recorder.compareAndSet(null, Objects.requireNonNull(started, "recorder"))) {
            throw new IllegalStateException("Recorder already deposited for session " + videoId());
        }
    }

    /** Takes the recorder out of the slot; null if never deposited or already taken. */
    Recorder reclaimRecorder() {
        return recorder.getAndSet(null);
    }

    /** Completes once the recorder has returned from stop, normally or with its failure. */
    Future<Void> captureStopped() {
        return captureStopped;
    }

    void markCaptureStopped() {
        captureStopped.complete(null);
    }

    void markCaptureStopFailed(Throwable cause) {
        captureStopped.completeExceptionally(cause);
    }

    SessionStatus snapshot() {
        boolean failed = completions.values().stream().anyMatch(TrackCompletion::isFailed);
        return new SessionStatus(true, videoId(), shutdown.get(),
                completion(TrackType.VIDEO).isFinished(),
                completion(TrackType.AUDIO).isFinished(),
                failed);
    }
}
