package com.williamcallahan.flarenormalizer.domain;

/**
 * Represents a non-fatal problem encountered while normalizing a document.
 * Recoverable problems degrade to placeholders in the tree and are reported here instead of
 * failing the whole conversion.
 */
public record ProcessingWarning(
    WarningType type,
    String message,
    String source
) {

    public ProcessingWarning {
        if (type == null) {
            throw new IllegalArgumentException("Warning type cannot be null");
        }
        if (message == null || message.trim().isEmpty()) {
            throw new IllegalArgumentException("Warning message cannot be null or empty");
        }
        source = source == null ? "" : source;
    }

    /**
     * Creates a processing warning without a source reference.
     * @param type the warning type
     * @param message the warning message
     * @return new ProcessingWarning instance
     */
    public static ProcessingWarning create(WarningType type, String message) {
        return new ProcessingWarning(type, message, "");
    }

    /**
     * Warning types for categorization.
     */
    public enum WarningType {
        /**
         * Snippet file missing or unreadable.
         */
        SNIPPET_NOT_FOUND,

        /**
         * Snippet includes itself directly or transitively.
         */
        CIRCULAR_SNIPPET,

        /**
         * Variable reference with no value in any loaded variable set.
         */
        UNRESOLVED_VARIABLE,

        /**
         * MadCap construct missing required parts.
         */
        MALFORMED_MADCAP_ELEMENT,

        /**
         * Attribute value that could not be decoded or interpreted.
         */
        MALFORMED_ATTRIBUTE,

        /**
         * Variable set file that could not be read or parsed.
         */
        VARIABLE_SET_UNREADABLE
    }
}
