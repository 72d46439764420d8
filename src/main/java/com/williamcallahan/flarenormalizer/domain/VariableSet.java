package com.williamcallahan.flarenormalizer.domain;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Variables defined by one {@code .flvar} file.
 *
 * @param namespace the file name without extension, the first segment of qualified references
 * @param sourcePath file the variables were read from
 * @param variables variable name to value, in file order
 */
public record VariableSet(String namespace, Path sourcePath, Map<String, String> variables) {

    public VariableSet {
        Objects.requireNonNull(namespace, "Namespace cannot be null");
        Objects.requireNonNull(variables, "Variables cannot be null");
        variables = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * Looks up a variable by its bare name.
     *
     * @param name variable name without namespace
     * @return the value when defined
     */
    public Optional<String> valueOf(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /**
     * @return the source file when the set was loaded from disk
     */
    public Optional<Path> source() {
        return Optional.ofNullable(sourcePath);
    }
}
