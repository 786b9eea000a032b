package de.mirkosertic.imagebatch.vault;

/**
 * A file inside the vault, identified by its normalized vault-relative path.
 */
public record VaultFile(String path) {

    public VaultFile {
        path = VaultPaths.normalize(path);
    }

    public String name() {
        return VaultPaths.fileName(path);
    }

    public String basename() {
        return VaultPaths.basename(path);
    }

    public String extension() {
        return VaultPaths.extension(path);
    }

    public String parent() {
        return VaultPaths.parent(path);
    }
}
