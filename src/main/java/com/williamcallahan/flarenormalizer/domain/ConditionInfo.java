package com.williamcallahan.flarenormalizer.domain;

import java.util.Objects;

/**
 * Classification of one condition name for reporting.
 *
 * @param name condition name with quotes and namespace prefixes removed
 * @param category taxonomy family the name belongs to
 * @param deprecated whether content tagged with it is skipped by default
 * @param usageCount number of files using the condition
 * @param description human-readable explanation
 */
public record ConditionInfo(
    String name,
    ConditionCategory category,
    boolean deprecated,
    int usageCount,
    String description
) {

    public ConditionInfo {
        Objects.requireNonNull(name, "Condition name cannot be null");
        Objects.requireNonNull(category, "Condition category cannot be null");
        description = description == null ? "" : description;
    }

    /**
     * Families recognized in condition names.
     */
    public enum ConditionCategory {
        STATUS,
        COLOR,
        PRINT,
        DEVELOPMENT,
        VISIBILITY,
        CUSTOM
    }
}
