package com.phillippitts.capturesync.service.capture;

/**
 * Handle to a running capture.
 */
public interface Recorder {

    /**
     * Stops writing new segments and flushes the ledgers before returning.
     *
     * @throws com.phillippitts.capturesync.exception.CaptureEngineException if the capture did not stop cleanly
     */
    void stopCapture();
}
