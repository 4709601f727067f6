package com.phillippitts.capturesync.service.upload.event;

import com.phillippitts.capturesync.domain.TrackType;
import com.phillippitts.capturesync.domain.UploadKind;

import java.time.Instant;

/**
 * Published when a single file upload fails. The file is not retried.
 *
 * Payload carries the file name only, never the absolute path.
 */
public record UploadFailedEvent(String videoId,
                                TrackType track,
                                UploadKind kind,
                                String fileName,
                                String reason,
                                Instant at) { }
