package com.phillippitts.capturesync.presentation.controller;

import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.domain.SessionStatus;
import com.phillippitts.capturesync.service.orchestration.SessionCoordinator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * REST surface for recording sessions.
 *
 * <p>{@code POST /start} is asynchronous: the response completes when the session has ended
 * (after a stop and the drain), mirroring the long-lived start operation. Setup failures
 * complete the response exceptionally and are mapped by the global exception handler.
 */
@RestController
@RequestMapping("/api/recording")
public class RecordingController {

    private static final Logger LOG = LogManager.getLogger(RecordingController.class);

    private final SessionCoordinator coordinator;
    private final Executor sessionExecutor;

    public RecordingController(SessionCoordinator coordinator,
                               @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this.coordinator = coordinator;
        this.sessionExecutor = sessionExecutor;
    }

    @PostMapping("/start")
    public CompletableFuture<ResponseEntity<SessionStatus>> start(@Valid @RequestBody RecordingOptions options) {
        LOG.info("Start requested (videoId={})", options.videoId());
        return CompletableFuture
                .runAsync(() -> coordinator.start(options), sessionExecutor)
                .thenApply(ignored -> ResponseEntity.ok(coordinator.status()));
    }

    @PostMapping("/stop")
    public ResponseEntity<Void> stop() {
        LOG.info("Stop requested");
        coordinator.stop();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/status")
    public SessionStatus status() {
        return coordinator.status();
    }
}
