package com.williamcallahan.flarenormalizer.service.conditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Condition labels whose content is excluded from conversion by default.
 *
 * The families are matched case-insensitively on word boundaries against the raw condition
 * attribute value, so {@code "Default.Deprecated, Online"} matches while {@code "Oldenburg"}
 * does not.
 */
@Component
public class SkipConditionTaxonomy {

    private static final Pattern CONDITION_ATTRIBUTE =
            Pattern.compile("(?:madcap:conditions|data-mc-conditions)=\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONDITION_SEPARATOR = Pattern.compile("[,;]");
    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"']|[\"']$");
    private static final Pattern NAMESPACE_PREFIX = Pattern.compile("^(?:General|Default)\\.", Pattern.CASE_INSENSITIVE);

    /**
     * Skip-worthy condition families, in evaluation order.
     */
    public enum SkipFamily {
        COLOR_CODED("\\b(Black|Red|Gray|Grey)\\b"),
        DEPRECATED("\\b(deprecated?|deprecation|obsolete|legacy|old)\\b"),
        HALTED("\\b(paused?|halted?|stopped?|discontinued?|retired?)\\b"),
        PRINT_ONLY("\\b(print[\\s\\-_]?only|printonly)\\b"),
        CANCELLED("\\b(cancelled?|canceled?|abandoned|shelved)\\b"),
        HIDDEN("\\b(hidden|internal|private|draft)\\b");

        private final Pattern pattern;

        SkipFamily(String regex) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }

        public boolean matches(String conditions) {
            return pattern.matcher(conditions).find();
        }
    }

    /**
     * Finds the first skip family matching a condition expression.
     *
     * @param conditions raw condition attribute value(s)
     * @return the matching family, empty when the content should be kept
     */
    public Optional<SkipFamily> classify(String conditions) {
        if (conditions == null || conditions.isBlank()) {
            return Optional.empty();
        }
        for (SkipFamily family : SkipFamily.values()) {
            if (family.matches(conditions)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    public boolean matches(String conditions) {
        return classify(conditions).isPresent();
    }

    /**
     * Cheap raw-text check used by batch runners before parsing: true when any condition attribute
     * in the markup carries a skip-worthy label.
     *
     * @param rawHtml unparsed document markup
     * @return true when the document contains excluded content
     */
    public boolean shouldSkipDocument(String rawHtml) {
        if (rawHtml == null || rawHtml.isEmpty()) {
            return false;
        }
        Matcher matcher = CONDITION_ATTRIBUTE.matcher(rawHtml);
        while (matcher.find()) {
            if (matches(matcher.group(1))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits a condition expression into individual names, dropping quotes and the
     * {@code General.} / {@code Default.} namespace prefixes.
     *
     * @param conditions raw condition attribute value(s)
     * @return condition names in attribute order
     */
    public static List<String> splitConditionNames(String conditions) {
        List<String> names = new ArrayList<>();
        if (conditions == null || conditions.isBlank()) {
            return names;
        }
        for (String part : CONDITION_SEPARATOR.split(conditions)) {
            String name = SURROUNDING_QUOTES.matcher(part.trim()).replaceAll("");
            name = NAMESPACE_PREFIX.matcher(name).replaceFirst("").trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
