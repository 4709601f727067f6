package com.phillippitts.capturesync.domain;

/**
 * The two parallel media streams of a recording session.
 *
 * <p>Each track is reconciled and uploaded independently; only {@link #VIDEO} carries the
 * companion screenshot.
 */
public enum TrackType {
    VIDEO("video", true),
    AUDIO("audio", false);

    private final String label;
    private final boolean ownsScreenshot;

    TrackType(String label, boolean ownsScreenshot) {
        this.label = label;
        this.ownsScreenshot = ownsScreenshot;
    }

    /** Label handed to the upload primitive and used in object keys, logs and metrics. */
    public String label() {
        return label;
    }

    public boolean ownsScreenshot() {
        return ownsScreenshot;
    }
}
