package com.phillippitts.capturesync.service.upload;

import com.phillippitts.capturesync.domain.RecordingOptions;

import java.nio.file.Path;

/**
 * Uploads one file to remote storage.
 *
 * Contract:
 * - Safe to call concurrently for distinct files
 * - Re-uploading the same path is harmless, but the dispatcher never does it
 * - Failures are reported by throwing {@link com.phillippitts.capturesync.exception.UploadException}
 */
public interface SegmentUploader {

    /**
     * Uploads a single file.
     *
     * @param options session identity and destination
     * @param file file on local disk
     * @param trackKindLabel "video", "audio" or "screenshot"
     */
    void upload(RecordingOptions options, Path file, String trackKindLabel);
}
