package com.phillippitts.capturesync.service.capture.ffmpeg;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Hermetic stand-ins for ffmpeg processes.
 */
final class CaptureTestDoubles {

    private CaptureTestDoubles() {}

    /**
     * Hands out pre-built processes in order and records the commands it was asked to run.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final Deque<Object> outcomes = new ArrayDeque<>();
        final List<List<String>> commands = new ArrayList<>();

        StubProcessFactory thenReturn(Process process) {
            outcomes.add(process);
            return this;
        }

        StubProcessFactory thenThrow(IOException failure) {
            outcomes.add(failure);
            return this;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            Object next = outcomes.poll();
            if (next instanceof IOException e) {
                throw e;
            }
            return (Process) next;
        }
    }

    /**
     * Fake ffmpeg: runs until it reads 'q' on stdin (if it honours quit) or is destroyed.
     */
    static final class FakeFfmpegProcess extends Process {
        private final CountDownLatch exited = new CountDownLatch(1);
        private final boolean honoursQuit;
        private final int quitExitCode;
        private final byte[] stderr;
        private volatile int exitCode;
        private volatile boolean quitReceived;
        private volatile boolean destroyCalled;

        private FakeFfmpegProcess(boolean honoursQuit, int quitExitCode, String stderr) {
            this.honoursQuit = honoursQuit;
            this.quitExitCode = quitExitCode;
            this.stderr = stderr.getBytes(StandardCharsets.UTF_8);
        }

        /** Keeps running and exits with {@code exitCode} once it reads 'q'. */
        static FakeFfmpegProcess running(int exitCode) {
            return new FakeFfmpegProcess(true, exitCode, "");
        }

        /** Keeps running and ignores 'q'; only destroy ends it. */
        static FakeFfmpegProcess hung() {
            return new FakeFfmpegProcess(false, 0, "");
        }

        /** Already gone, like ffmpeg rejecting its arguments. */
        static FakeFfmpegProcess exitedWith(int exitCode, String stderr) {
            FakeFfmpegProcess p = new FakeFfmpegProcess(false, exitCode, stderr);
            p.exit(exitCode);
            return p;
        }

        private void exit(int code) {
            if (exited.getCount() > 0) {
                exitCode = code;
                exited.countDown();
            }
        }

        boolean quitReceived() {
            return quitReceived;
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new OutputStream() {
                @Override
                public void write(int b) {
                    if (b == 'q') {
                        quitReceived = true;
                        if (honoursQuit) {
                            exit(quitExitCode);
                        }
                    }
                }
            };
        }

        @Override
        public InputStream getInputStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(stderr);
        }

        @Override
        public int waitFor() throws InterruptedException {
            exited.await();
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exited.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (exited.getCount() > 0) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            exit(143);
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }
    }
}
