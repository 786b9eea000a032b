package de.mirkosertic.imagebatch.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * {@link ImageProcessor} backed by {@code javax.imageio}.
 * <p>
 * Without additional ImageIO plugins on the class path only the JDK formats (PNG, JPEG,
 * GIF, BMP, TIFF) can be decoded and encoded; other formats fail with an
 * {@link ImageProcessingException}.
 */
public class ImageIoImageProcessor implements ImageProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ImageIoImageProcessor.class);

    /**
     * Width and height in pixels.
     */
    record Dimensions(int width, int height) {
    }

    @Override
    public byte[] transform(final byte[] imageData, final String sourceExtension, final ProcessingSettings settings)
            throws ImageProcessingException {
        final String formatName = formatName(sourceExtension, settings.outputFormat());

        if (settings.isKeepOriginalFormat() && settings.isNoCompression() && settings.isNoResize()) {
            return imageData;
        }

        final BufferedImage source = decode(imageData);
        final BufferedImage resized = resize(source, settings);
        final byte[] encoded = encode(resized, formatName, settings.quality());

        if (!settings.allowLargerFiles() && encoded.length > imageData.length) {
            logger.debug("Output of {} bytes is larger than input of {} bytes, keeping original", encoded.length,
                    imageData.length);
            return imageData;
        }
        return encoded;
    }

    /**
     * Compute target dimensions for a resize. For {@link ResizeMode#FILL} the result covers
     * the desired box; the caller crops the overflow.
     */
    static Dimensions calculateDimensions(final int naturalWidth, final int naturalHeight,
                                          final ProcessingSettings settings) {
        double width = naturalWidth;
        double height = naturalHeight;
        final double aspectRatio = width / height;
        final int desiredWidth = settings.desiredWidth();
        final int desiredHeight = settings.desiredHeight();
        final int desiredLength = settings.desiredLength();

        switch (settings.resizeMode()) {
            case NONE -> {
                return new Dimensions(naturalWidth, naturalHeight);
            }
            case FIT -> {
                if (aspectRatio > (double) desiredWidth / desiredHeight) {
                    width = desiredWidth;
                    height = width / aspectRatio;
                } else {
                    height = desiredHeight;
                    width = height * aspectRatio;
                }
            }
            case FILL -> {
                if (aspectRatio > (double) desiredWidth / desiredHeight) {
                    height = desiredHeight;
                    width = height * aspectRatio;
                } else {
                    width = desiredWidth;
                    height = width / aspectRatio;
                }
            }
            case LONGEST_EDGE -> {
                if (width > height) {
                    width = desiredLength;
                    height = width / aspectRatio;
                } else {
                    height = desiredLength;
                    width = height * aspectRatio;
                }
            }
            case SHORTEST_EDGE -> {
                if (width < height) {
                    width = desiredLength;
                    height = width / aspectRatio;
                } else {
                    height = desiredLength;
                    width = height * aspectRatio;
                }
            }
            case WIDTH -> {
                width = desiredWidth;
                height = width / aspectRatio;
            }
            case HEIGHT -> {
                height = desiredHeight;
                width = height * aspectRatio;
            }
        }

        switch (settings.enlargeOrReduce()) {
            case AUTO -> {
            }
            case REDUCE -> {
                // only shrink
                if (naturalWidth <= width && naturalHeight <= height) {
                    width = naturalWidth;
                    height = naturalHeight;
                }
            }
            case ENLARGE -> {
                // only grow
                if (!(naturalWidth < width && naturalHeight < height)) {
                    width = naturalWidth;
                    height = naturalHeight;
                }
            }
        }

        return new Dimensions(Math.max(1, (int) Math.round(width)), Math.max(1, (int) Math.round(height)));
    }

    private static String formatName(final String sourceExtension, final OutputFormat outputFormat) {
        if (outputFormat != OutputFormat.ORIGINAL) {
            return outputFormat.extension();
        }
        final String extension = sourceExtension.toLowerCase(Locale.ROOT);
        return switch (extension) {
            case "jpg" -> "jpeg";
            case "tif" -> "tiff";
            default -> extension;
        };
    }

    private static BufferedImage decode(final byte[] imageData) throws ImageProcessingException {
        final BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageData));
        } catch (final IOException e) {
            throw new ImageProcessingException("Failed to decode image", e);
        }
        if (image == null) {
            throw new ImageProcessingException("Unsupported or corrupt image data");
        }
        return image;
    }

    private static BufferedImage resize(final BufferedImage source, final ProcessingSettings settings) {
        if (settings.isNoResize()) {
            return source;
        }
        final Dimensions scaled = calculateDimensions(source.getWidth(), source.getHeight(), settings);

        int targetWidth = scaled.width();
        int targetHeight = scaled.height();
        if (settings.resizeMode() == ResizeMode.FILL) {
            targetWidth = Math.min(targetWidth, Math.max(1, settings.desiredWidth()));
            targetHeight = Math.min(targetHeight, Math.max(1, settings.desiredHeight()));
        }
        if (targetWidth == source.getWidth() && targetHeight == source.getHeight()) {
            return source;
        }

        final int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        final BufferedImage target = new BufferedImage(targetWidth, targetHeight, type);
        final Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            // center the scaled image; for FILL this crops the overflow
            final int x = (targetWidth - scaled.width()) / 2;
            final int y = (targetHeight - scaled.height()) / 2;
            graphics.drawImage(source, x, y, scaled.width(), scaled.height(), null);
        } finally {
            graphics.dispose();
        }
        return target;
    }

    private static byte[] encode(final BufferedImage image, final String formatName, final double quality)
            throws ImageProcessingException {
        final Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
        if (!writers.hasNext()) {
            throw new ImageProcessingException("No ImageIO writer available for format " + formatName);
        }
        final ImageWriter writer = writers.next();

        final BufferedImage output = "jpeg".equals(formatName) ? withoutAlpha(image) : image;
        final ImageWriteParam param = writer.getDefaultWriteParam();
        if (quality < 1.0 && param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            if (param.getCompressionType() == null && param.getCompressionTypes() != null
                    && param.getCompressionTypes().length > 0) {
                param.setCompressionType(param.getCompressionTypes()[0]);
            }
            param.setCompressionQuality((float) quality);
        }

        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (final ImageOutputStream stream = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(stream);
            writer.write(null, new IIOImage(output, null, null), param);
        } catch (final IOException e) {
            throw new ImageProcessingException("Failed to encode image as " + formatName, e);
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }

    private static BufferedImage withoutAlpha(final BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        final BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        final Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }
}
