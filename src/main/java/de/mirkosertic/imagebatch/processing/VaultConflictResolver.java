package de.mirkosertic.imagebatch.processing;

import de.mirkosertic.imagebatch.vault.VaultPaths;
import de.mirkosertic.imagebatch.vault.VaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConflictResolver} that probes the vault for existing names and appends a
 * numeric suffix ({@code photo-1.webp}, {@code photo-2.webp}, ...) in increment mode.
 */
public class VaultConflictResolver implements ConflictResolver {

    private static final Logger logger = LoggerFactory.getLogger(VaultConflictResolver.class);

    private final VaultStore store;

    public VaultConflictResolver(final VaultStore store) {
        this.store = store;
    }

    @Override
    public String resolveConflict(final String destinationDir, final String desiredFilename, final ConflictMode mode) {
        if (mode == ConflictMode.REUSE) {
            return desiredFilename;
        }

        final String folder = VaultPaths.normalize(destinationDir);
        if (!store.exists(VaultPaths.join(folder, desiredFilename))) {
            return desiredFilename;
        }

        final int dot = desiredFilename.lastIndexOf('.');
        final String nameWithoutExtension = dot > 0 ? desiredFilename.substring(0, dot) : desiredFilename;
        final String extension = dot > 0 ? desiredFilename.substring(dot) : "";

        int counter = 1;
        while (store.exists(VaultPaths.join(folder, nameWithoutExtension + "-" + counter + extension))) {
            counter++;
        }
        final String resolved = nameWithoutExtension + "-" + counter + extension;
        logger.debug("Name conflict for {} in '{}', using {}", desiredFilename, folder, resolved);
        return resolved;
    }
}
