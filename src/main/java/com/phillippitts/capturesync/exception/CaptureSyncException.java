package com.phillippitts.capturesync.exception;

/**
 * Base exception for all captureSync application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CaptureSyncException extends RuntimeException {

    public CaptureSyncException(String message) {
        super(message);
    }

    public CaptureSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public CaptureSyncException(Throwable cause) {
        super(cause);
    }
}
