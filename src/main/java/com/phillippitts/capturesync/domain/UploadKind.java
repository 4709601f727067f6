package com.phillippitts.capturesync.domain;

/** Logical kind of an uploaded file. */
public enum UploadKind {
    SEGMENT,
    SCREENSHOT;

    /** Label used for screenshot uploads in place of the track label. */
    public static final String SCREENSHOT_LABEL = "screenshot";
}
