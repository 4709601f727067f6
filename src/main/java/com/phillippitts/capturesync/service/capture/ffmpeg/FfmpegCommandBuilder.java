package com.phillippitts.capturesync.service.capture.ffmpeg;

import com.phillippitts.capturesync.config.capture.FfmpegCaptureProperties;
import com.phillippitts.capturesync.domain.RecordingOptions;
import com.phillippitts.capturesync.domain.SessionPaths;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds deterministic ffmpeg command lines for the video and audio capture processes.
 *
 * <p>Both use ffmpeg's segment muxer with a flat segment list, so every closed segment's file
 * name is appended to the track's ledger:
 * <pre>
 * ${binary} -hide_banner -nostats -y ${input-args} ${output-args}
 *     -f segment -segment_time ${seconds} -reset_timestamps 1
 *     -segment_list ${dir}/segment_list.txt -segment_list_type flat ${dir}/${pattern}
 * </pre>
 * The video command adds a second output that writes one frame to the screenshot file.
 */
final class FfmpegCommandBuilder {

    private final FfmpegCaptureProperties props;

    FfmpegCommandBuilder(FfmpegCaptureProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    List<String> videoCommand(RecordingOptions options, Path videoDir, Path screenshotDir) {
        List<String> cmd = prelude();
        cmd.addAll(substitute(props.getVideoInputArgs(), options, Optional.empty()));
        cmd.addAll(props.getVideoOutputArgs());
        appendSegmentOutput(cmd, videoDir, props.getVideoSegmentPattern());

        // Second output: a single frame for the session thumbnail
        cmd.add("-map");
        cmd.add("0:v");
        cmd.add("-frames:v");
        cmd.add("1");
        cmd.add("-update");
        cmd.add("1");
        cmd.add(screenshotDir.resolve(SessionPaths.SCREENSHOT_FILE_NAME).toAbsolutePath().toString());
        return cmd;
    }

    List<String> audioCommand(RecordingOptions options, Path audioDir, Optional<String> audioDevice) {
        List<String> cmd = prelude();
        cmd.addAll(substitute(props.getAudioInputArgs(), options, audioDevice));
        cmd.addAll(props.getAudioOutputArgs());
        appendSegmentOutput(cmd, audioDir, props.getAudioSegmentPattern());
        return cmd;
    }

    private List<String> prelude() {
        List<String> cmd = new ArrayList<>();
        cmd.add(props.getBinaryPath());
        cmd.add("-hide_banner");
        cmd.add("-nostats");
        cmd.add("-y");
        return cmd;
    }

    private void appendSegmentOutput(List<String> cmd, Path dir, String pattern) {
        cmd.add("-f");
        cmd.add("segment");
        cmd.add("-segment_time");
        cmd.add(String.valueOf(props.getSegmentSeconds()));
        cmd.add("-reset_timestamps");
        cmd.add("1");
        cmd.add("-segment_list");
        cmd.add(dir.resolve(SessionPaths.LEDGER_FILE_NAME).toAbsolutePath().toString());
        cmd.add("-segment_list_type");
        cmd.add("flat");
        cmd.add(dir.resolve(pattern).toAbsolutePath().toString());
    }

    private List<String> substitute(List<String> template, RecordingOptions options, Optional<String> audioDevice) {
        String screen = orDefault(options.screenIndex(), props.getDefaultScreenIndex());
        String video = orDefault(options.videoIndex(), props.getDefaultVideoIndex());
        String audio = audioDevice.orElse(props.getDefaultAudioDevice());
        List<String> out = new ArrayList<>(template.size());
        for (String arg : template) {
            out.add(arg.replace("{screen}", screen)
                    .replace("{video}", video)
                    .replace("{audio}", audio));
        }
        return out;
    }

    private static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value;
    }
}
