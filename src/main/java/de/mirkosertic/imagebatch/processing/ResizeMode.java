package de.mirkosertic.imagebatch.processing;

import java.util.Locale;

public enum ResizeMode {
    NONE,
    /** Fit inside desired width x height, keeping the aspect ratio. */
    FIT,
    /** Cover desired width x height, cropping the overflow. */
    FILL,
    LONGEST_EDGE,
    SHORTEST_EDGE,
    WIDTH,
    HEIGHT;

    /**
     * Parse the {@code resize-mode} setting, e.g. {@code None}, {@code Fit} or {@code LongestEdge}.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static ResizeMode fromSetting(final String value) {
        final String normalized = value == null ? "" : value.trim().replace("_", "").toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "none", "" -> NONE;
            case "fit" -> FIT;
            case "fill" -> FILL;
            case "longestedge" -> LONGEST_EDGE;
            case "shortestedge" -> SHORTEST_EDGE;
            case "width" -> WIDTH;
            case "height" -> HEIGHT;
            default -> throw new IllegalArgumentException("Unsupported resize-mode: " + value);
        };
    }
}
