package de.mirkosertic.imagebatch.processing;

import java.util.Locale;
import java.util.Set;

/**
 * Format a run converts images to. {@link #ORIGINAL} keeps each image's own format.
 */
public enum OutputFormat {
    ORIGINAL(null, Set.of()),
    WEBP("webp", Set.of("webp")),
    JPEG("jpeg", Set.of("jpeg", "jpg")),
    PNG("png", Set.of("png"));

    private final String extension;
    private final Set<String> extensions;

    OutputFormat(final String extension, final Set<String> extensions) {
        this.extension = extension;
        this.extensions = extensions;
    }

    /**
     * Parse the {@code convert-to} setting. {@code disabled} selects {@link #ORIGINAL}.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static OutputFormat fromSetting(final String value) {
        final String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "disabled", "original" -> ORIGINAL;
            case "webp" -> WEBP;
            case "jpg", "jpeg" -> JPEG;
            case "png" -> PNG;
            default -> throw new IllegalArgumentException("Unsupported convert-to format: " + value);
        };
    }

    /**
     * Canonical file extension, {@code null} for {@link #ORIGINAL}.
     */
    public String extension() {
        return extension;
    }

    /**
     * True if a file with this extension is already in this format. {@link #ORIGINAL}
     * matches every extension.
     */
    public boolean matchesExtension(final String fileExtension) {
        return this == ORIGINAL || extensions.contains(fileExtension.toLowerCase(Locale.ROOT));
    }
}
