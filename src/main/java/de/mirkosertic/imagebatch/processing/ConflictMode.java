package de.mirkosertic.imagebatch.processing;

import java.util.Locale;

public enum ConflictMode {
    /** Keep the desired name even if a file already carries it. */
    REUSE,
    /** Append {@code -1}, {@code -2}, ... until the name is free. */
    INCREMENT;

    public static ConflictMode fromSetting(final String value) {
        final String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "reuse" -> REUSE;
            case "increment", "" -> INCREMENT;
            default -> throw new IllegalArgumentException("Unsupported conflict-mode: " + value);
        };
    }
}
