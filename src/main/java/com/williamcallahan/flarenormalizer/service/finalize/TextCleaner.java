package com.williamcallahan.flarenormalizer.service.finalize;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes typographic characters in text content to a plain, stable form.
 *
 * Replacement is idempotent: cleaned text never contains a sequence that would be rewritten by
 * a second pass.
 */
final class TextCleaner {

    private static final Map<String, String> LITERAL_REPLACEMENTS = new LinkedHashMap<>();

    static {
        // Mis-decoded UTF-8 read as Windows-1252, longest sequences first
        LITERAL_REPLACEMENTS.put("â€™", "'");
        LITERAL_REPLACEMENTS.put("â€˜", "'");
        LITERAL_REPLACEMENTS.put("â€œ", "\"");
        LITERAL_REPLACEMENTS.put("â€\u009D", "\"");
        LITERAL_REPLACEMENTS.put("â€“", "-");
        LITERAL_REPLACEMENTS.put("â€”", "--");
        LITERAL_REPLACEMENTS.put("â€¦", "...");
        LITERAL_REPLACEMENTS.put("â€", "\"");
        LITERAL_REPLACEMENTS.put("Ã©", "é");
        LITERAL_REPLACEMENTS.put("Ã¨", "è");
        LITERAL_REPLACEMENTS.put("Ã¡", "á");
        LITERAL_REPLACEMENTS.put("Ã³", "ó");
        LITERAL_REPLACEMENTS.put("Ãº", "ú");
        LITERAL_REPLACEMENTS.put("Ã±", "ñ");
        LITERAL_REPLACEMENTS.put("Ã§", "ç");
        LITERAL_REPLACEMENTS.put("Ã¤", "ä");
        LITERAL_REPLACEMENTS.put("Ã¶", "ö");
        LITERAL_REPLACEMENTS.put("Ã¼", "ü");
        LITERAL_REPLACEMENTS.put("ÃŸ", "ß");
        LITERAL_REPLACEMENTS.put("\u00C2\u00A0", " ");

        // Entity names that survived as literal text (double-escaped in the source)
        LITERAL_REPLACEMENTS.put("&nbsp;", " ");
        LITERAL_REPLACEMENTS.put("&ensp;", " ");
        LITERAL_REPLACEMENTS.put("&emsp;", " ");
        LITERAL_REPLACEMENTS.put("&thinsp;", " ");
        LITERAL_REPLACEMENTS.put("&zwj;", "");
        LITERAL_REPLACEMENTS.put("&zwnj;", "");
        LITERAL_REPLACEMENTS.put("&shy;", "");
        LITERAL_REPLACEMENTS.put("&lrm;", "");
        LITERAL_REPLACEMENTS.put("&rlm;", "");

        LITERAL_REPLACEMENTS.put("\u2026", "...");
        LITERAL_REPLACEMENTS.put("\u2014", "--");
        LITERAL_REPLACEMENTS.put("\u2013", "-");
        LITERAL_REPLACEMENTS.put("\r\n", "\n");
    }

    private static final Pattern SINGLE_QUOTES = Pattern.compile("[\\u2018\\u2019\\u201A\\u201B]");
    private static final Pattern DOUBLE_QUOTES = Pattern.compile("[\\u201C\\u201D\\u201E\\u201F]");
    private static final Pattern WIDE_SPACES = Pattern.compile("[\\u00A0\\u2002-\\u2009\\u202F\\t]");
    private static final Pattern INVISIBLE = Pattern.compile("[\\u200B-\\u200F\\u00AD\\uFEFF]");
    private static final Pattern LINE_SEPARATORS = Pattern.compile("[\\u2028\\u2029\\r]");
    private static final Pattern SPACE_RUNS = Pattern.compile(" {2,}");

    private TextCleaner() {
    }

    /**
     * Cleans text that is rendered as flowing prose.
     */
    static String clean(String text) {
        String cleaned = normalizeCharacters(text);
        return SPACE_RUNS.matcher(cleaned).replaceAll(" ");
    }

    /**
     * Cleans text inside preformatted blocks, where spacing is significant.
     */
    static String cleanPreformatted(String text) {
        return normalizeCharacters(text);
    }

    private static String normalizeCharacters(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = text;
        for (Map.Entry<String, String> replacement : LITERAL_REPLACEMENTS.entrySet()) {
            if (cleaned.contains(replacement.getKey())) {
                cleaned = cleaned.replace(replacement.getKey(), replacement.getValue());
            }
        }
        cleaned = SINGLE_QUOTES.matcher(cleaned).replaceAll("'");
        cleaned = DOUBLE_QUOTES.matcher(cleaned).replaceAll("\"");
        cleaned = WIDE_SPACES.matcher(cleaned).replaceAll(" ");
        cleaned = INVISIBLE.matcher(cleaned).replaceAll("");
        return LINE_SEPARATORS.matcher(cleaned).replaceAll("\n");
    }
}
