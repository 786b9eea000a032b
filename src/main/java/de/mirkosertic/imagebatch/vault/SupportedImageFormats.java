package de.mirkosertic.imagebatch.vault;

import java.util.Locale;
import java.util.Set;

/**
 * Image formats the batch processor considers, by file extension.
 */
public class SupportedImageFormats {

    private static final Set<String> EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "webp", "heic", "heif",
            "avif", "tif", "tiff", "bmp", "svg", "gif"
    );

    public boolean isSupported(final String fileName) {
        return EXTENSIONS.contains(VaultPaths.extension(fileName).toLowerCase(Locale.ROOT));
    }
}
