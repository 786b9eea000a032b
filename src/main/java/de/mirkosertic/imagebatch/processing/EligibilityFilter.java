package de.mirkosertic.imagebatch.processing;

import de.mirkosertic.imagebatch.scan.ImageTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Decides which images a run touches at all.
 */
public class EligibilityFilter {

    private static final Logger logger = LoggerFactory.getLogger(EligibilityFilter.class);

    /**
     * Split a comma separated list of extensions into trimmed, lower-case, non-empty entries.
     */
    public static List<String> parseSkipFormats(final String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.toLowerCase(Locale.ROOT).split(","))
                .map(String::trim)
                .filter(format -> !format.isEmpty())
                .toList();
    }

    /**
     * @param keepOriginalFormat       true if the run keeps each image's format
     * @param targetFormat             format the run converts to
     * @param skipFormats              lower-case extensions that are never processed
     * @param skipIfAlreadyTargetFormat skip images whose extension already is the effective format
     */
    public boolean shouldProcess(final ImageTarget target, final boolean keepOriginalFormat,
                                 final OutputFormat targetFormat, final List<String> skipFormats,
                                 final boolean skipIfAlreadyTargetFormat) {
        final String extension = target.extension().toLowerCase(Locale.ROOT);

        if (skipFormats.contains(extension)) {
            logger.debug("Skipping {}: format {} is in skip list", target.name(), extension);
            return false;
        }

        // keeping the original format means every image already is in its effective format
        final boolean alreadyInFormat = keepOriginalFormat || targetFormat.matchesExtension(extension);
        if (skipIfAlreadyTargetFormat && alreadyInFormat) {
            logger.debug("Skipping {}: already in {} format", target.name(),
                    keepOriginalFormat ? extension : targetFormat.extension());
            return false;
        }

        return true;
    }

    public boolean shouldProcess(final ImageTarget target, final ProcessingSettings settings) {
        return shouldProcess(target, settings.isKeepOriginalFormat(), settings.outputFormat(),
                settings.skipFormats(), settings.skipImagesInTargetFormat());
    }

    /**
     * A run that keeps the format, does not compress and does not resize cannot change anything.
     */
    public boolean isNoOp(final ProcessingSettings settings) {
        return settings.isKeepOriginalFormat() && settings.isNoCompression() && settings.isNoResize();
    }

    /**
     * True if every image is either already in the effective format or in the skip list, and
     * the settings neither compress nor resize.
     */
    public boolean allSkippable(final Collection<ImageTarget> targets, final ProcessingSettings settings) {
        if (!settings.isNoCompression() || !settings.isNoResize()) {
            return false;
        }
        for (final ImageTarget target : targets) {
            final String extension = target.extension().toLowerCase(Locale.ROOT);
            final boolean inFormat = settings.isKeepOriginalFormat() || settings.outputFormat().matchesExtension(extension);
            if (!inFormat && !settings.skipFormats().contains(extension)) {
                return false;
            }
        }
        return true;
    }
}
