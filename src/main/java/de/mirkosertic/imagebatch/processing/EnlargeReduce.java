package de.mirkosertic.imagebatch.processing;

import java.util.Locale;

/**
 * Whether a resize may shrink, grow, or both.
 */
public enum EnlargeReduce {
    AUTO,
    REDUCE,
    ENLARGE;

    public static EnlargeReduce fromSetting(final String value) {
        final String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "auto", "" -> AUTO;
            case "reduce" -> REDUCE;
            case "enlarge" -> ENLARGE;
            default -> throw new IllegalArgumentException("Unsupported enlarge-or-reduce: " + value);
        };
    }
}
