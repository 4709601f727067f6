package com.phillippitts.capturesync.service.orchestration;

import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.domain.SessionStatus;

/**
 * Owns the lifecycle of the single active recording session.
 *
 * <p>{@link #start(RecordingOptions)} is long-lived: it returns once both track upload loops have
 * exited, which happens after {@link #stop()} signals shutdown and the drain passes complete.
 * Callers wanting a non-blocking start run it on their own thread.
 *
 * @since 1.0
 */
public interface SessionCoordinator {

    /**
     * Prepares the working directories, starts capture and runs one upload loop per track
     * until they drain.
     *
     * @param options session identity and destination
     * @throws com.phillippitts.capturesync.exception.SessionSetupException if no data directory is
     *         configured or the directories cannot be reset
     * @throws com.phillippitts.capturesync.exception.CaptureEngineException if capture fails to start
     * @throws com.phillippitts.capturesync.exception.SessionConflictException if a session is active
     */
    void start(RecordingOptions options);

    /**
     * Signals shutdown, stops capture and blocks until both tracks report their drain pass done.
     * No-op when no session is active.
     *
     * @throws com.phillippitts.capturesync.exception.CaptureEngineException if capture fails to stop
     * @throws com.phillippitts.capturesync.exception.DrainIncompleteException if a track failed or
     *         did not drain within the configured timeout
     */
    void stop();

    SessionStatus status();

    boolean isActive();
}
