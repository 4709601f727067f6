package com.phillippitts.capturesync.exception;

/**
 * Thrown when the capture engine fails to start or stop.
 */
public class CaptureEngineException extends SessionSetupException {

    private final int exitCode;

    public CaptureEngineException(String message) {
        super(message);
        this.exitCode = -1;
    }

    public CaptureEngineException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public CaptureEngineException(String message, int exitCode) {
        super(message + " (exit: " + exitCode + ")");
        this.exitCode = exitCode;
    }

    /** Process exit code, or -1 when the failure did not come from a process exit. */
    public int getExitCode() {
        return exitCode;
    }
}
