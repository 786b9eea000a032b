package de.mirkosertic.imagebatch.processing;

/**
 * An image could not be decoded, transformed or encoded.
 */
public class ImageProcessingException extends Exception {

    public ImageProcessingException(final String message) {
        super(message);
    }

    public ImageProcessingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
