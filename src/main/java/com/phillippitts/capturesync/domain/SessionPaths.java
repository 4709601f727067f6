package com.phillippitts.capturesync.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Working-directory layout of a recording session, derived from the configured data root.
 *
 * <pre>
 * &lt;root&gt;/chunks/video/segment_list.txt + segment files
 * &lt;root&gt;/chunks/audio/segment_list.txt + segment files
 * &lt;root&gt;/screenshots/screen-capture.jpg
 * </pre>
 */
public record SessionPaths(Path videoDir, Path audioDir, Path screenshotDir) {

    public static final String LEDGER_FILE_NAME = "segment_list.txt";
    public static final String SCREENSHOT_FILE_NAME = "screen-capture.jpg";

    public SessionPaths {
        Objects.requireNonNull(videoDir, "videoDir");
        Objects.requireNonNull(audioDir, "audioDir");
        Objects.requireNonNull(screenshotDir, "screenshotDir");
    }

    public static SessionPaths under(Path root) {
        Objects.requireNonNull(root, "root");
        Path chunks = root.resolve("chunks");
        return new SessionPaths(chunks.resolve("video"), chunks.resolve("audio"), root.resolve("screenshots"));
    }

    public Path segmentDir(TrackType track) {
        return track == TrackType.VIDEO ? videoDir : audioDir;
    }

    public Path ledgerFile(TrackType track) {
        return segmentDir(track).resolve(LEDGER_FILE_NAME);
    }

    public Path screenshotFile() {
        return screenshotDir.resolve(SCREENSHOT_FILE_NAME);
    }
}
