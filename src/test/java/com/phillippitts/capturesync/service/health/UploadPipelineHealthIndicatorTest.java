package com.phillippitts.capturesync.service.health;

import com.phillippitts.capturesync.domain.SessionStatus;
import com.phillippitts.capturesync.service.orchestration.SessionCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UploadPipelineHealthIndicatorTest {

    private final SessionCoordinator coordinator = mock(SessionCoordinator.class);
    private final UploadPipelineHealthIndicator indicator = new UploadPipelineHealthIndicator(coordinator);

    @Test
    void idleIsUp() {
        when(coordinator.status()).thenReturn(SessionStatus.idle());

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("session", "idle");
    }

    @Test
    void recordingIsUp() {
        when(coordinator.status()).thenReturn(new SessionStatus(true, "v1", false, false, false, false));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "recording")
                .containsEntry("videoId", "v1")
                .containsEntry("audio", "running");
    }

    @Test
    void drainingReportsFinishedTracks() {
        when(coordinator.status()).thenReturn(new SessionStatus(true, "v1", true, true, false, false));

        Health health = indicator.health();

        assertThat(health.getDetails())
                .containsEntry("status", "draining")
                .containsEntry("video", "finished");
    }

    @Test
    void failedTrackIsDegraded() {
        when(coordinator.status()).thenReturn(new SessionStatus(true, "v1", false, false, false, true));

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
    }
}
