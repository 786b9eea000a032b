package de.mirkosertic.imagebatch.vault;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Document and file store of a vault. All paths are vault-relative and use {@code /}.
 * <p>
 * Listing methods return files in ascending path order so that batch runs over an
 * unchanged vault always visit documents in the same order.
 */
public interface VaultStore {

    String read(String path) throws IOException;

    void write(String path, String content) throws IOException;

    byte[] readBinary(String path) throws IOException;

    void writeBinary(String path, byte[] data) throws IOException;

    /**
     * Move a file. Fails if {@code newPath} already exists.
     */
    void rename(String oldPath, String newPath) throws IOException;

    /**
     * @return the regular file at {@code path}, or {@code null} if there is none
     */
    @Nullable
    VaultFile resolve(String path);

    boolean exists(String path);

    boolean isFolder(String path);

    long size(String path) throws IOException;

    List<VaultFile> listFiles(String folder, boolean recursive) throws IOException;

    List<VaultFile> listNotes() throws IOException;

    List<VaultFile> listCanvasFiles() throws IOException;

    /**
     * Raw link targets of a note in order of appearance, duplicates included.
     * Targets are returned exactly as written in the note.
     */
    List<String> linkTargets(String notePath) throws IOException;

    /**
     * Resolve a link target as written in {@code sourcePath} to an existing file.
     *
     * @return the linked file, or {@code null} if it does not resolve
     */
    @Nullable
    VaultFile resolveLink(String linkText, String sourcePath);
}
