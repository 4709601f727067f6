package com.phillippitts.capturesync.service.capture.ffmpeg;

import com.phillippitts.capturesync.config.capture.FfmpegCaptureProperties;
import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.exception.CaptureEngineException;
import com.phillippitts.capturesync.service.capture.Recorder;
import com.phillippitts.capturesync.service.capture.ffmpeg.CaptureTestDoubles.FakeFfmpegProcess;
import com.phillippitts.capturesync.service.capture.ffmpeg.CaptureTestDoubles.StubProcessFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegCaptureEngineTest {

    private static final RecordingOptions OPTIONS = new RecordingOptions("u", "v", "1", "0", null, null, null);
    private static final Path VIDEO_DIR = Path.of("/tmp/capture/chunks/video");
    private static final Path AUDIO_DIR = Path.of("/tmp/capture/chunks/audio");
    private static final Path SHOT_DIR = Path.of("/tmp/capture/screenshots");

    private FfmpegCaptureProperties props;

    @BeforeEach
    void setUp() {
        props = new FfmpegCaptureProperties();
        props.setStopTimeoutMs(300);
    }

    private Recorder start(StubProcessFactory factory) {
        return new FfmpegCaptureEngine(props, factory)
                .startCapture(OPTIONS, AUDIO_DIR, SHOT_DIR, VIDEO_DIR, Optional.empty());
    }

    @Test
    void startsVideoThenAudioAndStopsBothWithQuit() {
        FakeFfmpegProcess video = FakeFfmpegProcess.running(0);
        FakeFfmpegProcess audio = FakeFfmpegProcess.running(0);
        StubProcessFactory factory = new StubProcessFactory().thenReturn(video).thenReturn(audio);

        Recorder recorder = start(factory);
        assertThat(video.isAlive()).isTrue();
        assertThat(audio.isAlive()).isTrue();
        assertThat(factory.commands).hasSize(2);
        assertThat(factory.commands.get(0)).contains("-frames:v");
        assertThat(factory.commands.get(1)).doesNotContain("-frames:v");

        recorder.stopCapture();

        assertThat(video.quitReceived()).isTrue();
        assertThat(audio.quitReceived()).isTrue();
        assertThat(video.isAlive()).isFalse();
        assertThat(audio.isAlive()).isFalse();
    }

    @Test
    void stopIsIdempotent() {
        StubProcessFactory factory = new StubProcessFactory()
                .thenReturn(FakeFfmpegProcess.running(0))
                .thenReturn(FakeFfmpegProcess.running(0));
        Recorder recorder = start(factory);

        recorder.stopCapture();
        assertThatCode(recorder::stopCapture).doesNotThrowAnyException();
    }

    @Test
    void processDyingOnStartupFailsWithExitCodeAndStderr() {
        StubProcessFactory factory = new StubProcessFactory()
                .thenReturn(FakeFfmpegProcess.exitedWith(1, "Input/output error: no such device"));

        assertThatThrownBy(() -> start(factory))
                .isInstanceOf(CaptureEngineException.class)
                .hasMessageContaining("no such device")
                .satisfies(e -> assertThat(((CaptureEngineException) e).getExitCode()).isEqualTo(1));
    }

    @Test
    void audioStartupFailureTerminatesVideo() {
        FakeFfmpegProcess video = FakeFfmpegProcess.running(0);
        StubProcessFactory factory = new StubProcessFactory()
                .thenReturn(video)
                .thenReturn(FakeFfmpegProcess.exitedWith(1, "audio device busy"));

        assertThatThrownBy(() -> start(factory)).isInstanceOf(CaptureEngineException.class);

        assertThat(video.wasDestroyCalled()).isTrue();
        assertThat(video.isAlive()).isFalse();
    }

    @Test
    void launchFailureIsWrapped() {
        StubProcessFactory factory = new StubProcessFactory().thenThrow(new IOException("ffmpeg not found"));

        assertThatThrownBy(() -> start(factory))
                .isInstanceOf(CaptureEngineException.class)
                .hasMessageContaining("Failed to launch ffmpeg video")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void hungProcessIsKilledAndOtherStillStopped() {
        FakeFfmpegProcess video = FakeFfmpegProcess.hung();
        FakeFfmpegProcess audio = FakeFfmpegProcess.running(0);
        Recorder recorder = start(new StubProcessFactory().thenReturn(video).thenReturn(audio));

        assertThatThrownBy(recorder::stopCapture)
                .isInstanceOf(CaptureEngineException.class)
                .hasMessageContaining("did not exit");

        assertThat(video.wasDestroyCalled()).isTrue();
        assertThat(audio.quitReceived()).isTrue();
        assertThat(video.isAlive()).isFalse();
        assertThat(audio.isAlive()).isFalse();
    }

    @Test
    void abnormalExitOnStopIsReported() {
        Recorder recorder = start(new StubProcessFactory()
                .thenReturn(FakeFfmpegProcess.running(0))
                .thenReturn(FakeFfmpegProcess.running(255)));

        assertThatThrownBy(recorder::stopCapture)
                .isInstanceOf(CaptureEngineException.class)
                .hasMessageContaining("ffmpeg audio exited abnormally")
                .satisfies(e -> assertThat(((CaptureEngineException) e).getExitCode()).isEqualTo(255));
    }
}
