package de.mirkosertic.imagebatch.vault;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * {@link VaultStore} over a directory on the local file system.
 * <p>
 * Link resolution follows the usual vault conventions: a target is first looked up
 * relative to the vault root, then relative to the linking document, and finally
 * by file name alone if exactly one file in the vault carries that name.
 */
public class FileSystemVaultStore implements VaultStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemVaultStore.class);

    private final Path root;
    private final FilePatternMatcher matcher;

    // file name (lower case) -> vault paths, rebuilt after renames
    private volatile Map<String, List<String>> nameIndex;

    public FileSystemVaultStore(final Path root, final FilePatternMatcher matcher) {
        this.root = root.toAbsolutePath().normalize();
        this.matcher = matcher;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public String read(final String path) throws IOException {
        return Files.readString(toFile(path), StandardCharsets.UTF_8);
    }

    @Override
    public void write(final String path, final String content) throws IOException {
        final byte[] data = content.getBytes(StandardCharsets.UTF_8);
        writeAtomically(toFile(path), out -> out.write(data));
    }

    @Override
    public byte[] readBinary(final String path) throws IOException {
        return Files.readAllBytes(toFile(path));
    }

    @Override
    public void writeBinary(final String path, final byte[] data) throws IOException {
        writeAtomically(toFile(path), out -> out.write(data));
    }

    /**
     * Writes into a temporary sibling of {@code target} and moves it over the target
     * once complete. If writing fails, the target keeps its previous content and the
     * temporary file is removed.
     */
    void writeAtomically(final Path target, final ContentWriter writer) throws IOException {
        final Path temp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            try (final OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                writer.writeTo(out);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (final IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (final IOException deleteFailure) {
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }
    }

    @FunctionalInterface
    interface ContentWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    @Override
    public void rename(final String oldPath, final String newPath) throws IOException {
        final Path target = toFile(newPath);
        final Path parent = target.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        Files.move(toFile(oldPath), target);
        nameIndex = null;
        logger.debug("Renamed {} -> {}", oldPath, newPath);
    }

    @Override
    public @Nullable VaultFile resolve(final String path) {
        final String normalized = VaultPaths.normalize(path);
        if (normalized.isEmpty() || normalized.startsWith("..")) {
            return null;
        }
        return Files.isRegularFile(toFile(normalized)) ? new VaultFile(normalized) : null;
    }

    @Override
    public boolean exists(final String path) {
        return Files.exists(toFile(path));
    }

    @Override
    public boolean isFolder(final String path) {
        return Files.isDirectory(toFile(path));
    }

    @Override
    public long size(final String path) throws IOException {
        return Files.size(toFile(path));
    }

    @Override
    public List<VaultFile> listFiles(final String folder, final boolean recursive) throws IOException {
        final Path start = toFile(folder);
        if (!Files.isDirectory(start)) {
            return List.of();
        }
        try (final Stream<Path> paths = Files.walk(start, recursive ? Integer.MAX_VALUE : 1)) {
            return paths.filter(Files::isRegularFile)
                    .map(this::toVaultPath)
                    .filter(matcher::shouldInclude)
                    .sorted()
                    .map(VaultFile::new)
                    .toList();
        }
    }

    @Override
    public List<VaultFile> listNotes() throws IOException {
        return listByExtension("md");
    }

    @Override
    public List<VaultFile> listCanvasFiles() throws IOException {
        return listByExtension("canvas");
    }

    @Override
    public List<String> linkTargets(final String notePath) throws IOException {
        return MarkdownLinkExtractor.extract(read(notePath));
    }

    @Override
    public @Nullable VaultFile resolveLink(final String linkText, final String sourcePath) {
        final String decoded = MarkdownLinkExtractor.decode(linkText);

        final VaultFile absolute = resolve(decoded);
        if (absolute != null) {
            return absolute;
        }

        final VaultFile relative = resolve(VaultPaths.join(VaultPaths.parent(sourcePath), decoded));
        if (relative != null) {
            return relative;
        }

        if (decoded.indexOf('/') < 0) {
            final List<String> candidates = nameIndex().getOrDefault(decoded.toLowerCase(Locale.ROOT), List.of());
            if (candidates.size() == 1) {
                return new VaultFile(candidates.get(0));
            }
            if (candidates.size() > 1) {
                logger.debug("Link '{}' in {} is ambiguous: {}", linkText, sourcePath, candidates);
            }
        }
        return null;
    }

    private List<VaultFile> listByExtension(final String extension) throws IOException {
        return listFiles("", true).stream()
                .filter(file -> extension.equalsIgnoreCase(file.extension()))
                .toList();
    }

    private Map<String, List<String>> nameIndex() {
        Map<String, List<String>> index = nameIndex;
        if (index == null) {
            index = new HashMap<>();
            try {
                for (final VaultFile file : listFiles("", true)) {
                    index.computeIfAbsent(file.name().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(file.path());
                }
            } catch (final IOException e) {
                logger.warn("Failed to build file name index for {}", root, e);
            }
            nameIndex = index;
        }
        return index;
    }

    private Path toFile(final String vaultPath) {
        final Path resolved = root.resolve(VaultPaths.normalize(vaultPath)).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the vault: " + vaultPath);
        }
        return resolved;
    }

    private String toVaultPath(final Path file) {
        return VaultPaths.normalize(root.relativize(file.toAbsolutePath().normalize()).toString());
    }
}
