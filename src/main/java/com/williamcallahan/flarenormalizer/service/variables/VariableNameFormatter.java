package com.williamcallahan.flarenormalizer.service.variables;

import java.util.regex.Pattern;

/**
 * Converts MadCap variable references into emitter attribute names.
 *
 * {@code General.ProductName} becomes {@code general-product-name}, the form AsciiDoc attributes
 * and Writerside variables share.
 */
public final class VariableNameFormatter {

    private static final Pattern UPPERCASE = Pattern.compile("([A-Z])");
    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-z0-9-]");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-{2,}");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-|-$");

    private VariableNameFormatter() {
        // Utility class - no instantiation
    }

    /**
     * Returns the kebab-case attribute name for a variable reference.
     *
     * @param variableName reference as written in the source
     * @return attribute name, empty for a blank reference
     */
    public static String toAttributeName(String variableName) {
        if (variableName == null || variableName.isBlank()) {
            return "";
        }
        String hyphenated = UPPERCASE.matcher(variableName.trim()).replaceAll("-$1");
        String lowered = hyphenated.toLowerCase(java.util.Locale.ROOT);
        String sanitized = INVALID_CHARS.matcher(lowered).replaceAll("-");
        String collapsed = REPEATED_HYPHENS.matcher(sanitized).replaceAll("-");
        return EDGE_HYPHENS.matcher(collapsed).replaceAll("");
    }
}
