package de.mirkosertic.imagebatch.processing;

import java.util.List;

/**
 * Conversion parameters of one kind of run. Runs over a note or folder and runs over the
 * whole vault each have their own instance.
 */
public record ProcessingSettings(
        OutputFormat outputFormat,
        /** 0..1; 1 means no lossy compression. */
        double quality,
        ResizeMode resizeMode,
        int desiredWidth,
        int desiredHeight,
        /** Target edge length for {@link ResizeMode#LONGEST_EDGE} and {@link ResizeMode#SHORTEST_EDGE}. */
        int desiredLength,
        EnlargeReduce enlargeOrReduce,
        /** If false, an output bigger than its input is discarded in favour of the input. */
        boolean allowLargerFiles,
        /** Lower-case extensions that are never processed. */
        List<String> skipFormats,
        boolean skipImagesInTargetFormat
) {
    public ProcessingSettings {
        if (Double.isNaN(quality) || quality < 0 || quality > 1) {
            throw new IllegalArgumentException("quality must be between 0 and 1, was " + quality);
        }
        if (resizeMode != ResizeMode.NONE && (desiredWidth < 0 || desiredHeight < 0 || desiredLength < 0)) {
            throw new IllegalArgumentException("Resize dimensions must not be negative");
        }
        skipFormats = List.copyOf(skipFormats);
    }

    public boolean isKeepOriginalFormat() {
        return outputFormat == OutputFormat.ORIGINAL;
    }

    public boolean isNoCompression() {
        return quality == 1.0;
    }

    public boolean isNoResize() {
        return resizeMode == ResizeMode.NONE;
    }
}
