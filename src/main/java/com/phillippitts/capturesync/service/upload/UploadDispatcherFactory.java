package com.phillippitts.capturesync.service.upload;

import com.phillippitts.capturesync.config.session.SessionProperties;
import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.domain.SessionPaths;
import com.phillippitts.capturesync.domain.TrackType;
import com.phillippitts.capturesync.service.ledger.SegmentLedgerReader;
import com.phillippitts.capturesync.service.metrics.UploadMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds one {@link TrackUploadDispatcher} per track and session, wiring in the shared
 * ledger reader, uploader, upload executor and metrics.
 */
@Component
public class UploadDispatcherFactory {

    private final SegmentLedgerReader ledgerReader;
    private final SegmentUploader uploader;
    private final Executor uploadExecutor;
    private final SessionProperties props;
    private final UploadMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public UploadDispatcherFactory(SegmentLedgerReader ledgerReader,
                                   SegmentUploader uploader,
                                   @Qualifier("uploadExecutor") Executor uploadExecutor,
                                   SessionProperties props,
                                   UploadMetrics metrics,
                                   ApplicationEventPublisher publisher) {
        this.ledgerReader = Objects.requireNonNull(ledgerReader, "ledgerReader");
        this.uploader = Objects.requireNonNull(uploader, "uploader");
        this.uploadExecutor = Objects.requireNonNull(uploadExecutor, "uploadExecutor");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Creates the dispatcher for one track. The video track also watches the session screenshot.
     *
     * @param track track to reconcile
     * @param paths session directory layout
     * @param options session identity handed to every upload
     * @param shutdownFlag shared flag, set once by stop
     * @param captureStopped completes once the recorder has stopped and flushed its ledgers
     * @param completion signal the dispatcher completes when it exits
     */
    public TrackUploadDispatcher create(TrackType track,
                                        SessionPaths paths,
                                        RecordingOptions options,
                                        AtomicBoolean shutdownFlag,
                                        Future<Void> captureStopped,
                                        TrackCompletion completion) {
        Path screenshot = track.ownsScreenshot() ? paths.screenshotFile() : null;
        return new TrackUploadDispatcher(
                track,
                paths.segmentDir(track),
                paths.ledgerFile(track),
                screenshot,
                options,
                ledgerReader,
                uploader,
                uploadExecutor,
                shutdownFlag,
                captureStopped,
                completion,
                props.getPollIntervalMs(),
                props.getCaptureStopWaitMs(),
                props.getScreenshotUploadDelayMs(),
                metrics,
                publisher);
    }
}
