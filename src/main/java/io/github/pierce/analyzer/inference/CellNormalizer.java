package io.github.pierce.analyzer.inference;

/**
 * Turns a raw cell into the text inference and statistics work on.
 */
public final class CellNormalizer {

    private CellNormalizer() {
    }

    /**
     * Returns the normalized cell, or null when the cell counts as missing.
     * An empty cell (after trimming, when enabled) is missing.
     */
    public static String normalize(String raw, boolean trimWhitespace) {
        if (raw == null) {
            return null;
        }
        String value = trimWhitespace ? raw.strip() : raw;
        return value.isEmpty() ? null : value;
    }
}
