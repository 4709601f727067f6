package com.phillippitts.capturesync.service.capture.ffmpeg;

import com.phillippitts.capturesync.exception.CaptureEngineException;
import com.phillippitts.capturesync.util.LogSanitizer;
import com.phillippitts.capturesync.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One running ffmpeg process together with its stderr gobbler.
 *
 * <p>Stderr is drained continuously (ffmpeg blocks once the pipe fills) and only the last
 * {@code stderrMaxChars} characters are kept for error reporting.
 */
final class CaptureProcess {

    private static final Logger LOG = LogManager.getLogger(CaptureProcess.class);
    private static final int ERROR_SNIPPET_MAX_CHARS = 1_000;

    private final String name;
    private final Process process;
    private final Thread errGobbler;
    private final StringBuilder stderr = new StringBuilder();
    private final int stderrMaxChars;

    CaptureProcess(String name, Process process, int stderrMaxChars) {
        this.name = name;
        this.process = process;
        this.stderrMaxChars = stderrMaxChars;
        this.errGobbler = startGobbler(process.getErrorStream(), "ffmpeg-" + name + "-err");
    }

    String name() {
        return name;
    }

    boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Verifies the process survived its first moments; ffmpeg exits immediately on bad devices
     * or arguments.
     *
     * @throws CaptureEngineException if the process already exited
     */
    void probeStarted(Duration probe) {
        try {
            if (process.waitFor(probe.toMillis(), TimeUnit.MILLISECONDS)) {
                joinQuietly(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
                throw new CaptureEngineException("ffmpeg " + name + " exited during startup; stderr="
                        + stderrSnippet(), process.exitValue());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate();
            throw new CaptureEngineException("Interrupted while starting ffmpeg " + name, e);
        }
    }

    /**
     * Asks ffmpeg to finish the current segment and exit ('q' on stdin), waiting up to the timeout.
     *
     * @throws CaptureEngineException on timeout or non-zero exit
     */
    void stop(Duration timeout) {
        requestQuit();
        try {
            boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                terminate();
                throw new CaptureEngineException("ffmpeg " + name + " did not exit within "
                        + timeout.toMillis() + " ms; killed");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate();
            throw new CaptureEngineException("Interrupted while stopping ffmpeg " + name, e);
        }
        joinQuietly(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new CaptureEngineException("ffmpeg " + name + " exited abnormally; stderr="
                    + stderrSnippet(), exitCode);
        }
        LOG.debug("ffmpeg {} exited cleanly", name);
    }

    /** Destroys the process, escalating to a forcible kill. */
    void terminate() {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("ffmpeg {} still alive after destroyForcibly", name);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying ffmpeg {}", name);
        }
    }

    String stderrSnippet() {
        synchronized (stderr) {
            return LogSanitizer.tail(stderr.toString(), ERROR_SNIPPET_MAX_CHARS);
        }
    }

    private void requestQuit() {
        try {
            OutputStream stdin = process.getOutputStream();
            stdin.write('q');
            stdin.write('\n');
            stdin.flush();
        } catch (IOException e) {
            // stdin already closed: the process is exiting or gone, waitFor decides
            LOG.debug("Could not send quit to ffmpeg {}: {}", name, e.toString());
        }
    }

    private Thread startGobbler(InputStream inputStream, String threadName) {
        Thread thread = new Thread(() -> gobble(inputStream), threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void gobble(InputStream inputStream) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                LOG.trace("[ffmpeg {}] {}", name, line);
                synchronized (stderr) {
                    stderr.append(line).append('\n');
                    int overflow = stderr.length() - stderrMaxChars;
                    if (overflow > 0) {
                        stderr.delete(0, overflow);
                    }
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler for ffmpeg {} stopped: {}", name, e.toString());
        }
    }

    private void joinQuietly(Duration timeout) {
        try {
            errGobbler.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
