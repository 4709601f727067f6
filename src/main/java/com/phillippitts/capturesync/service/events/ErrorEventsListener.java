package com.phillippitts.capturesync.service.events;

import com.phillippitts.capturesync.service.upload.event.TrackLoopFailedEvent;
import com.phillippitts.capturesync.service.upload.event.UploadFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for pipeline failure events. Throttled per video and track so a dead
 * network does not log one warning per segment.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onUploadFailed(UploadFailedEvent e) {
        String key = "upload-" + e.videoId() + '-' + e.track() + '-' + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Uploads failing for videoId={}, track={}, kind={} (latest: {}, reason={}). "
                    + "Check upload.s3.* settings and network; failed files are not retried.",
                    e.videoId(), e.track().label(), e.kind(), e.fileName(), e.reason());
        }
    }

    @EventListener
    void onTrackLoopFailed(TrackLoopFailedEvent e) {
        String key = "loop-" + e.videoId() + '-' + e.track();
        if (shouldLog(key)) {
            LOG.error("Upload loop for videoId={}, track={} stopped before draining: {}. "
                    + "Segments listed after this point will not be uploaded.",
                    e.videoId(), e.track().label(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
