package com.phillippitts.capturesync.exception;

/**
 * Thrown when a session cannot be started: missing data directory configuration or a
 * filesystem failure while resetting the working directories.
 * Fatal for the start attempt; retrying is safe since directory preparation is idempotent.
 */
public class SessionSetupException extends CaptureSyncException {

    public SessionSetupException(String message) {
        super(message);
    }

    public SessionSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
