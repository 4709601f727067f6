package com.phillippitts.capturesync.exception;

import java.nio.file.Path;

/**
 * Thrown when a segment ledger is missing or unreadable during a reconciliation pass.
 * Terminates the affected track's upload loop.
 */
public class LedgerReadException extends CaptureSyncException {

    private final Path ledgerPath;

    public LedgerReadException(Path ledgerPath, Throwable cause) {
        super("Failed to read segment ledger: " + ledgerPath, cause);
        this.ledgerPath = ledgerPath;
    }

    public Path getLedgerPath() {
        return ledgerPath;
    }
}
