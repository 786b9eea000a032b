package de.mirkosertic.imagebatch.scan;

import de.mirkosertic.imagebatch.vault.VaultPaths;
import org.jspecify.annotations.Nullable;

/**
 * Kinds of documents that can reference images.
 */
public enum DocumentKind {
    /** Markdown note; references are links in its text. */
    NOTE,
    /** Canvas graph; references are file nodes in its JSON. */
    CANVAS;

    /**
     * @return the kind for a document path, or {@code null} if the path is neither a note nor a canvas
     */
    public static @Nullable DocumentKind of(final String path) {
        final String extension = VaultPaths.extension(path);
        if ("md".equalsIgnoreCase(extension)) {
            return NOTE;
        }
        if ("canvas".equalsIgnoreCase(extension)) {
            return CANVAS;
        }
        return null;
    }
}
