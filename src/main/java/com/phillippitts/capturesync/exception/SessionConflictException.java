package com.phillippitts.capturesync.exception;

/**
 * Thrown when start is requested while another session is still registered.
 */
public class SessionConflictException extends CaptureSyncException {

    private final String activeVideoId;

    public SessionConflictException(String activeVideoId) {
        super("A recording session is already active (videoId: " + activeVideoId + ")");
        this.activeVideoId = activeVideoId;
    }

    public String getActiveVideoId() {
        return activeVideoId;
    }
}
