package com.phillippitts.capturesync.exception;

import com.phillippitts.capturesync.domain.TrackType;

/**
 * Thrown by stop when a track did not reach its finished state: the upload loop died on an
 * error, or the drain did not complete within the configured timeout.
 */
public class DrainIncompleteException extends CaptureSyncException {

    private final TrackType track;

    public DrainIncompleteException(TrackType track, String message) {
        super(message + " (track: " + track.label() + ")");
        this.track = track;
    }

    public DrainIncompleteException(TrackType track, String message, Throwable cause) {
        super(message + " (track: " + track.label() + ")", cause);
        this.track = track;
    }

    public TrackType getTrack() {
        return track;
    }
}
