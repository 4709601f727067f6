package com.phillippitts.capturesync.util;

import java.time.Duration;

/**
 * Standard timeout values for capture process and thread management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.capturesync.service.capture.ffmpeg.FfmpegCaptureEngine}
 * for subprocess lifecycle management.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     *
     * <p>Processes that survive this are typically unkillable due to OS bugs.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * How long a freshly started capture process must stay alive before start is considered
     * successful. ffmpeg exits almost immediately on a bad device or argument.
     */
    public static final Duration STARTUP_PROBE_TIMEOUT = Duration.ofMillis(300);

    private ProcessTimeouts() {
    }
}
