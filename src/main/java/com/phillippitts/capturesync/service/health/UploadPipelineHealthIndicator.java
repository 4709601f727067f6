package com.phillippitts.capturesync.service.health;

import com.phillippitts.capturesync.domain.SessionStatus;
import com.phillippitts.capturesync.service.orchestration.SessionCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the upload pipeline, exposed via /actuator/health.
 *
 * <ul>
 *   <li>UP: idle, or a session is running with both upload loops alive</li>
 *   <li>DEGRADED: a track's upload loop terminated without draining</li>
 * </ul>
 */
@Component
public class UploadPipelineHealthIndicator implements HealthIndicator {

    private final SessionCoordinator coordinator;

    public UploadPipelineHealthIndicator(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        SessionStatus status = coordinator.status();
        Health.Builder builder = new Health.Builder();
        if (!status.active()) {
            return builder.up().withDetail("session", "idle").build();
        }

        if (status.failed()) {
            builder.status("DEGRADED").withDetail("status", "Upload loop terminated without draining");
        } else {
            builder.up().withDetail("status", status.shutdownRequested() ? "draining" : "recording");
        }
        return builder
                .withDetail("videoId", status.videoId())
                .withDetail("video", trackStatus(status.videoFinished()))
                .withDetail("audio", trackStatus(status.audioFinished()))
                .build();
    }

    private static String trackStatus(boolean finished) {
        return finished ? "finished" : "running";
    }
}
