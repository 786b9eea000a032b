package de.mirkosertic.imagebatch.progress;

/**
 * Snapshot of the progress of the active run.
 */
public record RunProgress(
        /** Number of targets attempted so far, skipped ones included. */
        int index,
        int total,
        /** Wall clock start of the run in epoch milliseconds. */
        long startTime
) {
}
