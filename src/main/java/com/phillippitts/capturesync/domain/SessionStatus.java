package com.phillippitts.capturesync.domain;

/**
 * Point-in-time snapshot of the coordinator's session record.
 *
 * @param active whether a session is currently registered
 * @param videoId video id of the active session, or null when idle
 * @param shutdownRequested whether stop has signalled shutdown
 * @param videoFinished whether the video track has drained
 * @param audioFinished whether the audio track has drained
 * @param failed whether any track terminated on an error
 */
public record SessionStatus(
        boolean active,
        String videoId,
        boolean shutdownRequested,
        boolean videoFinished,
        boolean audioFinished,
        boolean failed
) {

    public static SessionStatus idle() {
        return new SessionStatus(false, null, false, false, false, false);
    }
}
