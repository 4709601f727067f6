package com.phillippitts.capturesync.service.upload.event;

import com.phillippitts.capturesync.domain.TrackType;

import java.time.Instant;

/**
 * Published when a track's upload loop terminates on an error before its drain pass.
 */
public record TrackLoopFailedEvent(String videoId, TrackType track, String reason, Instant at) { }
