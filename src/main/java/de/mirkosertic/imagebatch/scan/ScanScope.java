package de.mirkosertic.imagebatch.scan;

import de.mirkosertic.imagebatch.vault.VaultPaths;

/**
 * Breadth of a batch run.
 */
public record ScanScope(Kind kind, String path, boolean recursive) {

    public enum Kind {
        /** Images referenced by one note or canvas. */
        DOCUMENT,
        /** Image files in a folder; document content is not consulted. */
        FOLDER,
        /** Images referenced by the notes and canvases inside a folder. */
        LINKED_FOLDER,
        /** Images referenced anywhere in the vault. */
        VAULT
    }

    public ScanScope {
        path = VaultPaths.normalize(path);
    }

    public static ScanScope document(final String path) {
        return new ScanScope(Kind.DOCUMENT, path, false);
    }

    public static ScanScope folder(final String path, final boolean recursive) {
        return new ScanScope(Kind.FOLDER, path, recursive);
    }

    public static ScanScope linkedFolder(final String path, final boolean recursive) {
        return new ScanScope(Kind.LINKED_FOLDER, path, recursive);
    }

    public static ScanScope vault() {
        return new ScanScope(Kind.VAULT, "", true);
    }
}
