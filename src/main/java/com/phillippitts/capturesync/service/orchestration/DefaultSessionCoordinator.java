package com.phillippitts.capturesync.service.orchestration;

import com.phillippitts.capturesync.config.session.SessionProperties;
import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.domain.SessionPaths;
import com.phillippitts.capturesync.domain.SessionStatus;
import com.phillippitts.capturesync.domain.TrackType;
import com.phillippitts.capturesync.exception.CaptureSyncException;
import com.phillippitts.capturesync.exception.SessionConflictException;
import com.phillippitts.capturesync.exception.SessionSetupException;
import com.phillippitts.capturesync.service.capture.CaptureEngine;
import com.phillippitts.capturesync.service.capture.Recorder;
import com.phillippitts.capturesync.service.ledger.DirectoryPreparer;
import com.phillippitts.capturesync.service.upload.TrackUploadDispatcher;
import com.phillippitts.capturesync.service.upload.UploadDispatcherFactory;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Default {@link SessionCoordinator}: directory preparation, capture engine and one
 * {@link TrackUploadDispatcher} per track, with {@link SessionStateMachine} guarding the single
 * active session.
 *
 * <p><b>Start:</b> root check, session registration, directory reset, capture start, then both
 * upload loops are launched on the dispatcher executor and joined. The session stays registered
 * until both loops exit.
 *
 * <p><b>Stop:</b> shutdown flag, capture stop (through the recorder slot), then a bounded wait on
 * both tracks' completion signals. The loops hold their drain pass until the capture stop returns,
 * so segments the recorder flushes while stopping are still uploaded. A stop racing a start that has not yet deposited its recorder is
 * handled by start, which checks the flag after depositing and stops the recorder itself.
 *
 * @since 1.0
 */
public class DefaultSessionCoordinator implements SessionCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultSessionCoordinator.class);

    private final SessionProperties props;
    private final DirectoryPreparer preparer;
    private final CaptureEngine captureEngine;
    private final UploadDispatcherFactory dispatcherFactory;
    private final Executor dispatcherExecutor;
    private final SessionStateMachine stateMachine = new SessionStateMachine();

    public DefaultSessionCoordinator(SessionProperties props,
                                     DirectoryPreparer preparer,
                                     CaptureEngine captureEngine,
                                     UploadDispatcherFactory dispatcherFactory,
                                     Executor dispatcherExecutor) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.preparer = Objects.requireNonNull(preparer, "preparer must not be null");
        this.captureEngine = Objects.requireNonNull(captureEngine, "captureEngine must not be null");
        this.dispatcherFactory = Objects.requireNonNull(dispatcherFactory, "dispatcherFactory must not be null");
        this.dispatcherExecutor = Objects.requireNonNull(dispatcherExecutor, "dispatcherExecutor must not be null");
    }

    @Override
    public void start(RecordingOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        Path root = props.dataRoot().orElseThrow(() ->
                new SessionSetupException("No working directory configured (capture.session.data-dir)"));

        ActiveSession session = new ActiveSession(options, SessionPaths.under(root));
        if (!stateMachine.begin(session)) {
            ActiveSession other = stateMachine.current();
            throw new SessionConflictException(other == null ? "unknown" : other.videoId());
        }

        ThreadContext.put("videoId", options.videoId());
        try {
            List<CompletableFuture<Void>> loops;
            try {
                loops = setUp(session);
            } catch (RuntimeException e) {
                failPendingTracks(session, e);
                throw e;
            }
            LOG.info("Session started (userId={}, root={})", options.userId(), root);
            awaitLoops(loops);
        } finally {
            if (stateMachine.end(session)) {
                LOG.info("Session ended");
            }
            ThreadContext.remove("videoId");
        }
    }

    private List<CompletableFuture<Void>> setUp(ActiveSession session) {
        SessionPaths paths = session.paths();
        RecordingOptions options = session.options();
        preparer.prepare(paths);

        Recorder recorder = captureEngine.startCapture(options,
                paths.audioDir(), paths.screenshotDir(), paths.videoDir(), options.audioDevice());
        session.depositRecorder(recorder);
        if (session.isShutdownRequested()) {
            // stop ran before the recorder was deposited and could not reclaim it
            stopRecorder(session);
        }

        List<CompletableFuture<Void>> loops = new ArrayList<>();
        for (TrackType track : TrackType.values()) {
            TrackUploadDispatcher dispatcher = dispatcherFactory.create(track, paths, options,
                    session.shutdownFlag(), session.captureStopped(), session.completion(track));
            try {
                loops.add(CompletableFuture.runAsync(dispatcher, dispatcherExecutor));
            } catch (RejectedExecutionException e) {
                abortLaunch(session, track, e);
                // launched loops see the flag and drain before the start fails
                awaitLoops(loops);
                throw new SessionSetupException("No thread available for the " + track.label() + " upload loop", e);
            }
        }
        return loops;
    }

    private void abortLaunch(ActiveSession session, TrackType rejected, RejectedExecutionException cause) {
        LOG.error("Upload loop for {} rejected by dispatcher executor; aborting session", rejected.label());
        session.requestShutdown();
        try {
            stopRecorder(session);
        } catch (CaptureSyncException e) {
            LOG.warn("Capture stop during aborted start failed: {}", e.getMessage());
            cause.addSuppressed(e);
        }
    }

    /** Releases any stop waiting on tracks whose loop will never run. */
    private static void failPendingTracks(ActiveSession session, RuntimeException cause) {
        for (TrackType track : TrackType.values()) {
            session.completion(track).markFailed(cause);
        }
    }

    private void awaitLoops(List<CompletableFuture<Void>> loops) {
        try {
            CompletableFuture.allOf(loops.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            // The failing dispatcher already logged, completed its signal and published an event
            LOG.warn("Session upload loops ended with a failure: {}",
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        }
    }

    @Override
    public void stop() {
        ActiveSession session = stateMachine.current();
        if (session == null) {
            LOG.debug("stop called with no active session; ignoring");
            return;
        }
        if (session.requestShutdown()) {
            LOG.info("Stopping session (videoId={})", session.videoId());
        } else {
            LOG.debug("Shutdown already requested for session {}; waiting for drain", session.videoId());
        }

        stopRecorder(session);

        Duration budget = props.drainTimeout();
        long deadline = System.nanoTime() + budget.toNanos();
        for (TrackType track : TrackType.values()) {
            Duration remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
            session.completion(track).await(remaining);
        }
        if (stateMachine.end(session)) {
            LOG.info("Session drained (videoId={})", session.videoId());
        }
    }

    /**
     * Stops the recorder if this caller reclaimed it, then releases the upload loops waiting to drain.
     * A null slot means start has not deposited yet (it will stop the recorder itself) or another
     * stop already took it.
     */
    private static void stopRecorder(ActiveSession session) {
        Recorder recorder = session.reclaimRecorder();
        if (recorder == null) {
            return;
        }
        try {
            recorder.stopCapture();
        } catch (RuntimeException e) {
            session.markCaptureStopFailed(e);
            throw e;
        }
        session.markCaptureStopped();
    }

    @Override
    public SessionStatus status() {
        ActiveSession session = stateMachine.current();
        return session == null ? SessionStatus.idle() : session.snapshot();
    }

    @Override
    public boolean isActive() {
        return stateMachine.isActive();
    }

    /**
     * Best-effort stop when the application context closes.
     */
    @PreDestroy
    public void shutdown() {
        if (!isActive()) {
            return;
        }
        LOG.info("Application shutting down; stopping active session");
        try {
            stop();
        } catch (CaptureSyncException e) {
            LOG.warn("Session did not stop cleanly during shutdown: {}", e.getMessage());
        }
    }
}
