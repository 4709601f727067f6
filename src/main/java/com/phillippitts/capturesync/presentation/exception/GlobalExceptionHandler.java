package com.phillippitts.capturesync.presentation.exception;

import com.phillippitts.capturesync.exception.CaptureEngineException;
import com.phillippitts.capturesync.exception.DrainIncompleteException;
import com.phillippitts.capturesync.exception.SessionConflictException;
import com.phillippitts.capturesync.exception.SessionSetupException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts session exceptions to HTTP responses. Paths, stderr output and S3 keys stay in the
 * logs and never reach clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Another session is active (HTTP 409).
     */
    @ExceptionHandler(SessionConflictException.class)
    ResponseEntity<ApiError> handleConflict(SessionConflictException ex) {
        LOG.warn("Start rejected: session {} is active", ex.getActiveVideoId());
        return error(HttpStatus.CONFLICT, ex, "Recording session already active",
                "Stop the active session before starting a new one");
    }

    /**
     * Capture engine failed to start or stop (HTTP 502).
     * Checked before its parent {@link SessionSetupException}.
     */
    @ExceptionHandler(CaptureEngineException.class)
    ResponseEntity<ApiError> handleCaptureEngine(CaptureEngineException ex) {
        LOG.error("Capture engine failure: exitCode={}, {}", ex.getExitCode(), ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex, "Capture engine failure",
                "Check capture devices and permissions");
    }

    /**
     * Missing data directory or directory reset failure (HTTP 503). Retrying is safe.
     */
    @ExceptionHandler(SessionSetupException.class)
    ResponseEntity<ApiError> handleSetup(SessionSetupException ex) {
        LOG.error("Session setup failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Recording session could not be set up",
                "Check capture.session.data-dir and retry");
    }

    /**
     * A track did not drain (HTTP 500). Some segments may not have been uploaded.
     */
    @ExceptionHandler(DrainIncompleteException.class)
    ResponseEntity<ApiError> handleDrainIncomplete(DrainIncompleteException ex) {
        LOG.error("Drain incomplete for track {}: {}", ex.getTrack().label(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Upload drain incomplete",
                "Track " + ex.getTrack().label() + " did not finish uploading");
    }

    /**
     * Invalid start request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidOptions(MethodArgumentNotValidException ex) {
        LOG.warn("Invalid recording options: {} field error(s)", ex.getErrorCount());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid recording options",
                "userId and videoId are required");
    }

    /**
     * No thread available to run a start (HTTP 503).
     */
    @ExceptionHandler(RejectedExecutionException.class)
    ResponseEntity<ApiError> handleRejected(RejectedExecutionException ex) {
        LOG.warn("Start rejected: session executor saturated");
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Session executor busy",
                "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
