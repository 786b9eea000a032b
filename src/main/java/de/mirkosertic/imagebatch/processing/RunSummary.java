package de.mirkosertic.imagebatch.processing;

import de.mirkosertic.imagebatch.scan.ScanScope;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of a batch run.
 */
public record RunSummary(
        ScanScope scope,
        /** Number of unique targets found by the scan. */
        int total,
        Map<ProcessingOutcome, Integer> outcomes,
        /** Renames in processing order. */
        List<Rename> renames,
        long elapsedMs,
        /** Set if the run ended before processing any image, e.g. because nothing could change. */
        boolean skipped
) {
    public RunSummary {
        final EnumMap<ProcessingOutcome, Integer> counts = new EnumMap<>(ProcessingOutcome.class);
        for (final ProcessingOutcome outcome : ProcessingOutcome.values()) {
            counts.put(outcome, outcomes.getOrDefault(outcome, 0));
        }
        outcomes = Map.copyOf(counts);
        renames = List.copyOf(renames);
    }

    /**
     * Summary of a run that did not process anything.
     */
    public static RunSummary nothingToDo(final ScanScope scope, final int total, final long elapsedMs) {
        return new RunSummary(scope, total, Map.of(), List.of(), elapsedMs, true);
    }

    public int count(final ProcessingOutcome outcome) {
        return outcomes.get(outcome);
    }

    public int processedCount() {
        return count(ProcessingOutcome.PROCESSED_AND_RENAMED) + count(ProcessingOutcome.PROCESSED_NO_RENAME);
    }

    public record Rename(String oldPath, String newPath) {
    }
}
