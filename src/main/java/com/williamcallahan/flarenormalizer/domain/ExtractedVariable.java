package com.williamcallahan.flarenormalizer.domain;

import java.util.Objects;

/**
 * A variable definition recorded while emitting attribute references instead of literal values.
 *
 * @param name the MadCap reference as written in the source, e.g. {@code General.ProductName}
 * @param value the resolved value from the project variable sets
 */
public record ExtractedVariable(String name, String value) {

    public ExtractedVariable {
        Objects.requireNonNull(name, "Variable name cannot be null");
        Objects.requireNonNull(value, "Variable value cannot be null");
    }
}
