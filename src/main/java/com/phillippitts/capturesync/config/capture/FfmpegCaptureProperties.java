package com.phillippitts.capturesync.config.capture;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the ffmpeg-based capture engine.
 * Binds to properties prefixed with "capture.ffmpeg".
 *
 * <p>Input argument templates may contain the placeholders {@code {screen}}, {@code {video}}
 * and {@code {audio}}, replaced with the session's screen index, video index and audio device.
 *
 * <p>Example application.properties (macOS):
 * <pre>
 * capture.ffmpeg.binary-path=/opt/homebrew/bin/ffmpeg
 * capture.ffmpeg.segment-seconds=3
 * capture.ffmpeg.video-input-args=-f,avfoundation,-framerate,30,-i,{screen}:none
 * capture.ffmpeg.audio-input-args=-f,avfoundation,-i,:{audio}
 * </pre>
 */
@ConfigurationProperties(prefix = "capture.ffmpeg")
@Validated
public class FfmpegCaptureProperties {

    @NotBlank(message = "ffmpeg binary path must not be blank")
    private String binaryPath = "ffmpeg";

    /** Target duration of one segment. */
    @Min(value = 1, message = "Segment duration must be at least 1 second")
    private int segmentSeconds = 3;

    @NotEmpty
    private List<String> videoInputArgs = new ArrayList<>(List.of(
            "-f", "avfoundation", "-capture_cursor", "1", "-framerate", "30", "-i", "{screen}:none"));

    private List<String> videoOutputArgs = new ArrayList<>(List.of(
            "-c:v", "libx264", "-preset", "ultrafast", "-pix_fmt", "yuv420p"));

    @NotBlank
    private String videoSegmentPattern = "video_%05d.ts";

    @NotEmpty
    private List<String> audioInputArgs = new ArrayList<>(List.of("-f", "avfoundation", "-i", ":{audio}"));

    private List<String> audioOutputArgs = new ArrayList<>(List.of("-c:a", "aac", "-b:a", "128k"));

    @NotBlank
    private String audioSegmentPattern = "audio_%05d.ts";

    /** Used for {audio} when the session names no audio device. */
    @NotBlank
    private String defaultAudioDevice = "0";

    /** Used for {screen} / {video} when the session leaves them blank. */
    @NotBlank
    private String defaultScreenIndex = "1";

    @NotBlank
    private String defaultVideoIndex = "0";

    /** How long stop waits for ffmpeg to finalize the last segment after 'q'. */
    @Min(value = 100, message = "Stop timeout must be at least 100 ms")
    private long stopTimeoutMs = 5_000;

    /** Maximum stderr retained per process for error reporting. */
    @Min(1024)
    private int stderrMaxChars = 16_384;

    public String getBinaryPath() {
        return binaryPath;
    }

    public void setBinaryPath(String binaryPath) {
        this.binaryPath = binaryPath;
    }

    public int getSegmentSeconds() {
        return segmentSeconds;
    }

    public void setSegmentSeconds(int segmentSeconds) {
        this.segmentSeconds = segmentSeconds;
    }

    public List<String> getVideoInputArgs() {
        return videoInputArgs;
    }

    public void setVideoInputArgs(List<String> videoInputArgs) {
        this.videoInputArgs = videoInputArgs;
    }

    public List<String> getVideoOutputArgs() {
        return videoOutputArgs;
    }

    public void setVideoOutputArgs(List<String> videoOutputArgs) {
        this.videoOutputArgs = videoOutputArgs;
    }

    public String getVideoSegmentPattern() {
        return videoSegmentPattern;
    }

    public void setVideoSegmentPattern(String videoSegmentPattern) {
        this.videoSegmentPattern = videoSegmentPattern;
    }

    public List<String> getAudioInputArgs() {
        return audioInputArgs;
    }

    public void setAudioInputArgs(List<String> audioInputArgs) {
        this.audioInputArgs = audioInputArgs;
    }

    public List<String> getAudioOutputArgs() {
        return audioOutputArgs;
    }

    public void setAudioOutputArgs(List<String> audioOutputArgs) {
        this.audioOutputArgs = audioOutputArgs;
    }

    public String getAudioSegmentPattern() {
        return audioSegmentPattern;
    }

    public void setAudioSegmentPattern(String audioSegmentPattern) {
        this.audioSegmentPattern = audioSegmentPattern;
    }

    public String getDefaultAudioDevice() {
        return defaultAudioDevice;
    }

    public void setDefaultAudioDevice(String defaultAudioDevice) {
        this.defaultAudioDevice = defaultAudioDevice;
    }

    public String getDefaultScreenIndex() {
        return defaultScreenIndex;
    }

    public void setDefaultScreenIndex(String defaultScreenIndex) {
        this.defaultScreenIndex = defaultScreenIndex;
    }

    public String getDefaultVideoIndex() {
        return defaultVideoIndex;
    }

    public void setDefaultVideoIndex(String defaultVideoIndex) {
        this.defaultVideoIndex = defaultVideoIndex;
    }

    public long getStopTimeoutMs() {
        return stopTimeoutMs;
    }

    public void setStopTimeoutMs(long stopTimeoutMs) {
        this.stopTimeoutMs = stopTimeoutMs;
    }

    public int getStderrMaxChars() {
        return stderrMaxChars;
    }

    public void setStderrMaxChars(int stderrMaxChars) {
        this.stderrMaxChars = stderrMaxChars;
    }
}
