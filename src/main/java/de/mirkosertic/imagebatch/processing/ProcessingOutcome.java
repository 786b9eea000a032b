package de.mirkosertic.imagebatch.processing;

/**
 * Result of processing a single image target.
 */
public enum ProcessingOutcome {
    PROCESSED_AND_RENAMED,
    PROCESSED_NO_RENAME,
    SKIPPED_BY_FILTER,
    SKIPPED_BY_ERROR;

    public boolean isProcessed() {
        return this == PROCESSED_AND_RENAMED || this == PROCESSED_NO_RENAME;
    }
}
