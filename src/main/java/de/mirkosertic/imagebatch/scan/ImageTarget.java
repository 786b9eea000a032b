package de.mirkosertic.imagebatch.scan;

import de.mirkosertic.imagebatch.vault.VaultFile;
import de.mirkosertic.imagebatch.vault.VaultStore;

import java.io.IOException;
import java.util.Objects;

/**
 * An image considered for processing in a run. Identity is the normalized vault path.
 * <p>
 * Targets are immutable; processing that renames the file yields a new path and the
 * old target is discarded.
 */
public final class ImageTarget {

    private final VaultFile file;
    private final VaultStore store;

    private long sizeInBytes = -1;

    public ImageTarget(final VaultFile file, final VaultStore store) {
        this.file = file;
        this.store = store;
    }

    public String path() {
        return file.path();
    }

    public String name() {
        return file.name();
    }

    public String basename() {
        return file.basename();
    }

    public String extension() {
        return file.extension();
    }

    public String parent() {
        return file.parent();
    }

    /**
     * Size of the file on disk, read on first access.
     */
    public long sizeInBytes() throws IOException {
        if (sizeInBytes < 0) {
            sizeInBytes = store.size(file.path());
        }
        return sizeInBytes;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ImageTarget other && file.path().equals(other.file.path());
    }

    @Override
    public int hashCode() {
        return Objects.hash(file.path());
    }

    @Override
    public String toString() {
        return file.path();
    }
}
