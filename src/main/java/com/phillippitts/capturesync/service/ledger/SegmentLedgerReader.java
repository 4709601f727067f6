package com.phillippitts.capturesync.service.ledger;

import com.phillippitts.capturesync.exception.LedgerReadException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the append-only segment ledger written by the recorder.
 *
 * <p>The ledger is a newline-delimited list of segment file names. Order carries no meaning and
 * duplicate lines collapse, so the result is a set. Empty lines are skipped.
 *
 * <p>A missing ledger is an error: the directory preparer creates it before any dispatcher runs.
 */
@Component
public class SegmentLedgerReader {

    /**
     * Returns the distinct non-empty lines of the ledger.
     *
     * @param ledgerPath path to {@code segment_list.txt}
     * @return segment file names listed so far (mutable, owned by the caller)
     * @throws LedgerReadException if the file is missing or cannot be read
     */
    public Set<String> read(Path ledgerPath) {
        Objects.requireNonNull(ledgerPath, "ledgerPath");
        Set<String> segments = new HashSet<>();
        try (BufferedReader reader = Files.newBufferedReader(ledgerPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isEmpty()) {
                    segments.add(line);
                }
            }
        } catch (IOException e) {
            throw new LedgerReadException(ledgerPath, e);
        }
        return segments;
    }
}
