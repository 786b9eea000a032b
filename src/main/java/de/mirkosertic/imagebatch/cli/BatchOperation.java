package de.mirkosertic.imagebatch.cli;

import de.mirkosertic.imagebatch.processing.BatchImageProcessor;
import de.mirkosertic.imagebatch.processing.RunSummary;

/**
 * One batch run, selected on the command line.
 */
@FunctionalInterface
public interface BatchOperation {

    RunSummary runOn(BatchImageProcessor processor);
}
