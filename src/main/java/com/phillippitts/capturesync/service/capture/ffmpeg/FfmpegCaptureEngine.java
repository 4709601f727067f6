package com.phillippitts.capturesync.service.capture.ffmpeg;

import com.phillippitts.capturesync.config.capture.FfmpegCaptureProperties;
import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.exception.CaptureEngineException;
import com.phillippitts.capturesync.service.capture.CaptureEngine;
import com.phillippitts.capturesync.service.capture.Recorder;
import com.phillippitts.capturesync.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Capture engine backed by two ffmpeg processes, one per track.
 *
 * <p>Responsibilities:
 * - Build the command lines via {@link FfmpegCommandBuilder}
 * - Start the processes via {@link ProcessFactory} and fail fast if either dies on startup
 * - Stop both on {@link Recorder#stopCapture()}, letting ffmpeg close its last segment and ledger entry
 *
 * <p>If the audio process fails to start, the already running video process is terminated so
 * no orphaned capture keeps writing into the session directories.
 */
@Component
public class FfmpegCaptureEngine implements CaptureEngine {

    private static final Logger LOG = LogManager.getLogger(FfmpegCaptureEngine.class);

    private final FfmpegCaptureProperties props;
    private final ProcessFactory processFactory;
    private final FfmpegCommandBuilder commandBuilder;

    @Autowired
    public FfmpegCaptureEngine(FfmpegCaptureProperties props) {
        this(props, new DefaultProcessFactory());
    }

    FfmpegCaptureEngine(FfmpegCaptureProperties props, ProcessFactory processFactory) {
        this.props = Objects.requireNonNull(props, "props");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.commandBuilder = new FfmpegCommandBuilder(props);
    }

    @Override
    public Recorder startCapture(RecordingOptions options,
                                 Path audioDir,
                                 Path screenshotDir,
                                 Path videoDir,
                                 Optional<String> audioDevice) {
        Objects.requireNonNull(options, "options");
        List<String> videoCmd = commandBuilder.videoCommand(options, videoDir, screenshotDir);
        List<String> audioCmd = commandBuilder.audioCommand(options, audioDir, audioDevice);

        CaptureProcess video = launch("video", videoCmd, videoDir);
        CaptureProcess audio;
        try {
            audio = launch("audio", audioCmd, audioDir);
        } catch (CaptureEngineException e) {
            LOG.warn("Audio capture failed to start; terminating video capture");
            video.terminate();
            throw e;
        }
        LOG.info("Capture started (videoId={}, audioDevice={})",
                options.videoId(), audioDevice.orElse("default"));
        return new FfmpegRecorder(List.of(video, audio), Duration.ofMillis(props.getStopTimeoutMs()));
    }

    private CaptureProcess launch(String name, List<String> command, Path workingDir) {
        LOG.debug("Starting ffmpeg {}: {}", name, command);
        Process process;
        try {
            process = processFactory.start(command, workingDir);
        } catch (IOException e) {
            throw new CaptureEngineException("Failed to launch ffmpeg " + name + " (" + props.getBinaryPath() + ")", e);
        }
        CaptureProcess capture = new CaptureProcess(name, process, props.getStderrMaxChars());
        capture.probeStarted(ProcessTimeouts.STARTUP_PROBE_TIMEOUT);
        return capture;
    }

    /**
     * Recorder over the running ffmpeg processes. Stopping is idempotent.
     */
    static final class FfmpegRecorder implements Recorder {

        private final List<CaptureProcess> processes;
        private final Duration stopTimeout;
        private boolean stopped;

        FfmpegRecorder(List<CaptureProcess> processes, Duration stopTimeout) {
            this.processes = processes;
            this.stopTimeout = stopTimeout;
        }

        @Override
        public synchronized void stopCapture() {
            if (stopped) {
                return;
            }
            stopped = true;
            // Stop every process before reporting, so one failure never leaves another running
            List<CaptureEngineException> failures = new ArrayList<>();
            for (CaptureProcess process : processes) {
                try {
                    process.stop(stopTimeout);
                } catch (CaptureEngineException e) {
                    LOG.warn("Stopping ffmpeg {} failed: {}", process.name(), e.getMessage());
                    failures.add(e);
                }
            }
            if (!failures.isEmpty()) {
                CaptureEngineException first = failures.get(0);
                failures.stream().skip(1).forEach(first::addSuppressed);
                throw first;
            }
            LOG.info("Capture stopped");
        }
    }
}
