package com.phillippitts.capturesync.service.capture;

import com.phillippitts.capturesync.domain.RecordingOptions;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Screen and audio capture engine.
 *
 * Contract:
 * - Writes rolling segment files into the given track directories
 * - Appends each closed segment's file name to {@code segment_list.txt} in that directory
 * - Writes {@code screen-capture.jpg} into the screenshot directory at most once per session
 */
public interface CaptureEngine {

    /**
     * Starts capturing. The returned recorder is owned by the caller until stopped.
     *
     * @param options session options (screen/video selectors)
     * @param audioDir audio segment directory (already prepared)
     * @param screenshotDir screenshot directory (already prepared)
     * @param videoDir video segment directory (already prepared)
     * @param audioDevice audio input device name, empty for the platform default
     * @return handle used to stop the capture
     * @throws com.phillippitts.capturesync.exception.CaptureEngineException if capture cannot start
     */
    Recorder startCapture(RecordingOptions options,
                          Path audioDir,
                          Path screenshotDir,
                          Path videoDir,
                          Optional<String> audioDevice);
}
