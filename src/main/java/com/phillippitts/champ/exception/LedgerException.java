package com.phillippitts.champ.exception;

import java.nio.file.Path;

/**
 * Thrown when a round record cannot be persisted to the chained ledger.
 *
 * <p>Not recoverable locally: an entry that was not written leaves a gap in the audit trail,
 * so callers receive this as a hard failure for that round's logging step.
 */
public class LedgerException extends ChampException {

    private final Path entryPath;

    public LedgerException(String message, Path entryPath, Throwable cause) {
        super(message + " (entry: " + entryPath + ")", cause);
        this.entryPath = entryPath;
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
        this.entryPath = null;
    }

    /**
     * @return path of the entry being written, or null if the failure happened before a path was known
     */
    public Path getEntryPath() {
        return entryPath;
    }
}
