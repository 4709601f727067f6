package com.phillippitts.capturesync.service.orchestration;

import com.phillippitts.capturesync.config.session.SessionProperties;
import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.domain.SessionPaths;
import com.phillippitts.capturesync.domain.SessionStatus;
import com.phillippitts.capturesync.domain.TrackType;
import com.phillippitts.capturesync.exception.CaptureEngineException;
import com.phillippitts.capturesync.exception.DrainIncompleteException;
import com.phillippitts.capturesync.exception.SessionConflictException;
import com.phillippitts.capturesync.exception.SessionSetupException;
import com.phillippitts.capturesync.service.ledger.DirectoryPreparer;
import com.phillippitts.capturesync.service.ledger.SegmentLedgerReader;
import com.phillippitts.capturesync.service.metrics.UploadMetrics;
import com.phillippitts.capturesync.service.upload.UploadDispatcherFactory;
import com.phillippitts.capturesync.testutil.EventCapturingPublisher;
import com.phillippitts.capturesync.testutil.FakeCaptureEngine;
import com.phillippitts.capturesync.testutil.RecordingSegmentUploader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.capturesync.testutil.SessionFiles.writeFile;
import static com.phillippitts.capturesync.testutil.SessionFiles.writeSegment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link DefaultSessionCoordinator} with real loops over a temporary directory,
 * a fake capture engine and a recording uploader.
 */
class DefaultSessionCoordinatorTest {

    private static final RecordingOptions OPTIONS =
            new RecordingOptions("user-1", "video-1", "1", "0", "MacBook Microphone", null, "bucket");

    @TempDir
    Path root;

    private SessionProperties props;
    private FakeCaptureEngine engine;
    private RecordingSegmentUploader uploader;
    private ExecutorService dispatcherPool;
    private ExecutorService uploadPool;
    private ExecutorService callerPool;
    private DefaultSessionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        props = new SessionProperties();
        props.setDataDir(root.toString());
        props.setPollIntervalMs(10);
        props.setDrainTimeoutMs(5_000);
        props.setScreenshotUploadDelayMs(0);
        engine = new FakeCaptureEngine();
        uploader = new RecordingSegmentUploader();
        dispatcherPool = Executors.newCachedThreadPool();
        uploadPool = Executors.newFixedThreadPool(4);
        callerPool = Executors.newCachedThreadPool();
        coordinator = newCoordinator(props);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
        dispatcherPool.shutdownNow();
        uploadPool.shutdownNow();
        callerPool.shutdownNow();
    }

    private DefaultSessionCoordinator newCoordinator(SessionProperties sessionProps) {
        UploadDispatcherFactory factory = new UploadDispatcherFactory(new SegmentLedgerReader(), uploader,
                uploadPool, sessionProps, new UploadMetrics(new SimpleMeterRegistry()), new EventCapturingPublisher());
        return new DefaultSessionCoordinator(sessionProps, new DirectoryPreparer(), engine, factory, dispatcherPool);
    }

    private CompletableFuture<Void> startAsync() {
        CompletableFuture<Void> running = CompletableFuture.runAsync(() -> coordinator.start(OPTIONS), callerPool);
        await().atMost(Duration.ofSeconds(5)).until(() -> engine.startCount.get() == 1 && coordinator.isActive());
        return running;
    }

    private SessionPaths paths() {
        return SessionPaths.under(root);
    }

    @Test
    void startFailsWithoutDataDirectory() {
        SessionProperties noRoot = new SessionProperties();
        DefaultSessionCoordinator unconfigured = newCoordinator(noRoot);

        assertThatThrownBy(() -> unconfigured.start(OPTIONS))
                .isInstanceOf(SessionSetupException.class)
                .hasMessageContaining("No working directory");
        assertThat(engine.startCount.get()).isZero();
        assertThat(unconfigured.isActive()).isFalse();
    }

    @Test
    void captureStartFailureAbortsBeforeAnyLoopRuns() {
        engine.failOnStart();

        assertThatThrownBy(() -> coordinator.start(OPTIONS)).isInstanceOf(CaptureEngineException.class);

        assertThat(coordinator.isActive()).isFalse();
        assertThat(coordinator.status()).isEqualTo(SessionStatus.idle());
        assertThat(paths().ledgerFile(TrackType.VIDEO)).isEmptyFile();
    }

    @Test
    void startHandsPreparedDirectoriesToTheCaptureEngine() throws Exception {
        CompletableFuture<Void> running = startAsync();

        assertThat(engine.lastVideoDir()).isEqualTo(paths().videoDir());
        assertThat(engine.lastAudioDir()).isEqualTo(paths().audioDir());
        assertThat(engine.lastScreenshotDir()).isEqualTo(paths().screenshotDir());
        assertThat(engine.lastAudioDevice()).contains("MacBook Microphone");
        assertThat(paths().ledgerFile(TrackType.AUDIO)).exists();

        coordinator.stop();
        running.get(5, TimeUnit.SECONDS);
    }

    @Test
    void stopDrainsEverySegmentIncludingTheOneFlushedOnStop() throws Exception {
        engine.onStop(() -> {
            writeSegment(paths().videoDir(), "video_final.ts");
            writeSegment(paths().audioDir(), "audio_final.ts");
        });
        CompletableFuture<Void> running = startAsync();

        writeSegment(paths().videoDir(), "video_00000.ts");
        writeSegment(paths().audioDir(), "audio_00000.ts");
        writeFile(paths().screenshotFile(), "jpeg");

        coordinator.stop();

        assertThat(uploader.uploadedFileNames()).containsExactlyInAnyOrder(
                "video_00000.ts", "audio_00000.ts", "screen-capture.jpg", "video_final.ts", "audio_final.ts");
        assertThat(engine.stopCount.get()).isEqualTo(1);
        running.get(5, TimeUnit.SECONDS);
        assertThat(coordinator.isActive()).isFalse();
    }

    @Test
    void segmentFlushedByASlowCaptureStopIsStillUploaded() throws Exception {
        engine.onStop(() -> {
            // several poll intervals pass before the recorder writes its last segment
            sleep(250);
            writeSegment(paths().videoDir(), "video_final.ts");
            writeSegment(paths().audioDir(), "audio_final.ts");
        });
        CompletableFuture<Void> running = startAsync();
        writeSegment(paths().videoDir(), "video_00000.ts");

        coordinator.stop();

        assertThat(uploader.uploadedFileNames())
                .contains("video_00000.ts", "video_final.ts", "audio_final.ts");
        running.get(5, TimeUnit.SECONDS);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void secondStartWhileActiveConflictsAndLeavesDirectoriesAlone() throws Exception {
        CompletableFuture<Void> running = startAsync();
        writeFile(paths().videoDir().resolve("keep.ts"), "in progress");

        assertThatThrownBy(() -> coordinator.start(OPTIONS))
                .isInstanceOf(SessionConflictException.class)
                .hasMessageContaining("video-1");

        assertThat(paths().videoDir().resolve("keep.ts")).exists();
        assertThat(engine.startCount.get()).isEqualTo(1);

        coordinator.stop();
        running.get(5, TimeUnit.SECONDS);
    }

    @Test
    void stopWithoutSessionIsNoOp() {
        assertThatCode(() -> coordinator.stop()).doesNotThrowAnyException();
        assertThat(engine.stopCount.get()).isZero();
    }

    @Test
    void stopBlocksUntilInFlightUploadsComplete() throws Exception {
        CompletableFuture<Void> running = startAsync();
        CountDownLatch gate = uploader.holdUploads();
        writeSegment(paths().audioDir(), "slow.ts");

        CompletableFuture<Void> stopping = CompletableFuture.runAsync(coordinator::stop, callerPool);
        Thread.sleep(200);
        assertThat(stopping).isNotDone();
        assertThat(coordinator.status().shutdownRequested()).isTrue();

        gate.countDown();
        stopping.get(5, TimeUnit.SECONDS);
        running.get(5, TimeUnit.SECONDS);
        assertThat(uploader.uploadedFileNames()).contains("slow.ts");
    }

    @Test
    void trackDyingOnLedgerErrorFailsStopInsteadOfHanging() throws Exception {
        CompletableFuture<Void> running = startAsync();
        Files.delete(paths().ledgerFile(TrackType.AUDIO));

        await().atMost(Duration.ofSeconds(5)).until(() -> coordinator.status().failed());

        assertThatThrownBy(() -> coordinator.stop())
                .isInstanceOf(DrainIncompleteException.class)
                .satisfies(e -> assertThat(((DrainIncompleteException) e).getTrack()).isEqualTo(TrackType.AUDIO));

        running.get(5, TimeUnit.SECONDS);
        assertThat(coordinator.isActive()).isFalse();
    }

    @Test
    void captureStopFailureIsFatalButLoopsStillDrain() throws Exception {
        engine.failOnStop();
        CompletableFuture<Void> running = startAsync();
        writeSegment(paths().videoDir(), "v0.ts");

        assertThatThrownBy(() -> coordinator.stop()).isInstanceOf(CaptureEngineException.class);

        running.get(5, TimeUnit.SECONDS);
        assertThat(uploader.uploadedFileNames()).contains("v0.ts");
        assertThat(coordinator.isActive()).isFalse();
    }

    @Test
    void newSessionCanStartAfterPreviousOneDrained() throws Exception {
        CompletableFuture<Void> first = startAsync();
        writeSegment(paths().videoDir(), "first.ts");
        coordinator.stop();
        first.get(5, TimeUnit.SECONDS);

        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> coordinator.start(OPTIONS), callerPool);
        await().atMost(Duration.ofSeconds(5)).until(() -> engine.startCount.get() == 2 && coordinator.isActive());

        assertThat(paths().videoDir().resolve("first.ts")).doesNotExist();
        coordinator.stop();
        second.get(5, TimeUnit.SECONDS);
    }
}
