package de.mirkosertic.imagebatch.vault;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Helpers for vault-relative paths. Vault paths always use {@code /} as separator,
 * never start or end with a slash, and the vault root itself is the empty string.
 */
public final class VaultPaths {

    private VaultPaths() {
    }

    /**
     * Normalize a path: unify separators, drop empty and {@code .} segments and
     * resolve {@code ..} segments. A {@code ..} that would leave the vault is kept
     * so callers can reject it.
     */
    public static String normalize(final String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        final Deque<String> segments = new ArrayDeque<>();
        for (final String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment) && !segments.isEmpty() && !"..".equals(segments.peekLast())) {
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    public static String parent(final String path) {
        final int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    public static String fileName(final String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    public static String extension(final String path) {
        final String name = fileName(path);
        final int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1);
    }

    public static String basename(final String path) {
        final String name = fileName(path);
        final int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    public static String join(final String folder, final String name) {
        return folder == null || folder.isEmpty() ? name : folder + "/" + name;
    }

    /**
     * True if {@code path} lies inside {@code folder}. With {@code recursive} set,
     * any depth counts; otherwise only immediate children do.
     */
    public static boolean isInFolder(final String path, final String folder, final boolean recursive) {
        final String prefix = folder.isEmpty() ? "" : folder + "/";
        if (!path.startsWith(prefix)) {
            return false;
        }
        return recursive || path.indexOf('/', prefix.length()) < 0;
    }
}
