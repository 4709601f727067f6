package com.phillippitts.capturesync.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Transient unit of upload work: one file of one track.
 *
 * <p>Created when a new file is detected, discarded once its upload attempt completes.
 * Failed tasks are never retried.
 *
 * @param file absolute path of the file to upload
 * @param track track the file belongs to
 * @param kind segment or screenshot
 */
public record UploadTask(Path file, TrackType track, UploadKind kind) {

    public UploadTask {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(track, "track");
        Objects.requireNonNull(kind, "kind");
    }

    /** Label passed to the upload primitive: the track label for segments, "screenshot" otherwise. */
    public String uploadLabel() {
        return kind == UploadKind.SCREENSHOT ? UploadKind.SCREENSHOT_LABEL : track.label();
    }

    public String fileName() {
        return file.getFileName().toString();
    }
}
