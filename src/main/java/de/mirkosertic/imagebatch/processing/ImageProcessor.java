package de.mirkosertic.imagebatch.processing;

/**
 * Converts and resizes encoded image bytes.
 */
public interface ImageProcessor {

    /**
     * @param imageData       encoded source image
     * @param sourceExtension file extension of the source, used when the format is kept
     * @param settings        conversion and resize parameters
     * @return the encoded result in {@link ProcessingSettings#outputFormat()}, or in the
     *         source format for {@link OutputFormat#ORIGINAL}
     * @throws ImageProcessingException if the image cannot be decoded or encoded
     */
    byte[] transform(byte[] imageData, String sourceExtension, ProcessingSettings settings)
            throws ImageProcessingException;
}
