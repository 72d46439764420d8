package com.williamcallahan.flarenormalizer.support;

/**
 * Provides locale-independent ASCII text normalization for case-insensitive comparisons.
 *
 * Tag names, attribute names, CSS class tokens and condition labels in MadCap sources are
 * technical identifiers, so only ASCII uppercase letters (A-Z) are folded; all other characters
 * are left unchanged regardless of the default locale.
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';

    private AsciiTextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        if (!hasAsciiUppercase(text)) {
            return text;
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Folds a condition label for set membership checks.
     *
     * @param label raw label, possibly padded (may be null)
     * @return trimmed label with ASCII letters lowercased, or empty string if null
     */
    public static String foldLabel(String label) {
        return label == null ? "" : toLowerAscii(label.trim());
    }

    public static boolean hasAsciiUppercase(String text) {
        if (text == null) {
            return false;
        }
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                return true;
            }
        }
        return false;
    }
}
