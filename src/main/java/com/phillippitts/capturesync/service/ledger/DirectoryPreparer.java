package com.phillippitts.capturesync.service.ledger;

import com.phillippitts.capturesync.domain.SessionPaths;
import com.phillippitts.capturesync.exception.SessionSetupException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Resets session working directories to an empty, known-good state.
 *
 * <p>On return a segment directory exists, holds nothing from a previous session and contains an
 * empty ledger file ready for appends. A screenshot directory is reset the same way but gets no
 * ledger. Applying the preparer twice to the same path yields the same end state.
 *
 * <p>Filesystem errors surface as {@link SessionSetupException}. When one directory fails after
 * others were reset, the partial state is left in place; a retry converges.
 */
@Component
public class DirectoryPreparer {

    private static final Logger LOG = LogManager.getLogger(DirectoryPreparer.class);

    /**
     * Resets all three directories of a session: video, audio, then screenshots.
     */
    public void prepare(SessionPaths paths) {
        Objects.requireNonNull(paths, "paths");
        prepareSegmentDirectory(paths.videoDir());
        prepareSegmentDirectory(paths.audioDir());
        prepareScreenshotDirectory(paths.screenshotDir());
    }

    /**
     * Resets a segment directory and ensures it contains an empty ledger.
     *
     * @param dir directory the recorder writes segments and {@code segment_list.txt} to
     * @throws SessionSetupException on any filesystem failure
     */
    public void prepareSegmentDirectory(Path dir) {
        resetDirectory(dir);
        Path ledger = dir.resolve(SessionPaths.LEDGER_FILE_NAME);
        try {
            if (Files.notExists(ledger)) {
                Files.createFile(ledger);
            }
        } catch (FileAlreadyExistsException e) {
            LOG.debug("Ledger {} created concurrently; keeping it", ledger);
        } catch (IOException e) {
            throw new SessionSetupException("Failed to create segment ledger " + ledger, e);
        }
    }

    /**
     * Resets a screenshot directory. No ledger is created.
     */
    public void prepareScreenshotDirectory(Path dir) {
        resetDirectory(dir);
    }

    private void resetDirectory(Path dir) {
        Objects.requireNonNull(dir, "dir");
        try {
            if (Files.exists(dir)) {
                FileSystemUtils.deleteRecursively(dir);
            }
            Files.createDirectories(dir);
            LOG.debug("Reset working directory {}", dir);
        } catch (IOException e) {
            throw new SessionSetupException("Failed to reset working directory " + dir, e);
        }
    }
}
