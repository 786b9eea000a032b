package de.mirkosertic.imagebatch.vault;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Glob based exclusion of vault paths, e.g. the application's settings folder or the trash.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> excludePatterns) {
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public boolean shouldInclude(final String vaultPath) {
        final Path path = Path.of(vaultPath);
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(path)) {
                return false;
            }
        }
        return true;
    }
}
