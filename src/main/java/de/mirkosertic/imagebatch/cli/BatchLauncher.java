package de.mirkosertic.imagebatch.cli;

/**
 * Sets up logging, configuration and the vault, then performs a {@link BatchOperation}.
 */
@FunctionalInterface
public interface BatchLauncher {

    /**
     * @return the process exit code
     */
    int launch(BatchOperation operation);
}
