package com.williamcallahan.flarenormalizer.service.variables;

import com.williamcallahan.flarenormalizer.domain.VariableSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All variable sets of one project, merged for lookup.
 *
 * Later sets overwrite earlier ones when they define the same name. Immutable once built, so one
 * instance is shared by every document of the project.
 */
public final class ProjectVariables {

    private static final ProjectVariables EMPTY = new ProjectVariables(List.of(), List.of());

    private final List<VariableSet> sets;
    private final Map<String, String> qualified = new HashMap<>();
    private final Map<String, String> bare = new HashMap<>();
    private final List<String> loadProblems;

    /**
     * @param sets variable sets in load order
     * @param loadProblems descriptions of files that could not be read or parsed
     */
    public ProjectVariables(List<VariableSet> sets, List<String> loadProblems) {
        this.sets = List.copyOf(sets);
        this.loadProblems = List.copyOf(loadProblems);
        for (VariableSet set : this.sets) {
            set.variables().forEach((name, value) -> {
                qualified.put(set.namespace() + "." + name, value);
                bare.put(name, value);
            });
        }
    }

    public static ProjectVariables empty() {
        return EMPTY;
    }

    /**
     * Resolves a variable reference.
     *
     * The full dotted reference is tried first; when absent, the last segment is looked up as a
     * bare name across every loaded set, covering references whose namespace does not match the
     * file the variable lives in.
     *
     * @param reference reference such as {@code General.ProductName}
     * @return the value, or empty when no set defines it
     */
    public Optional<String> resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reference.trim();
        String direct = qualified.get(trimmed);
        if (direct != null) {
            return Optional.of(direct);
        }
        int lastDot = trimmed.lastIndexOf('.');
        String lastSegment = lastDot >= 0 ? trimmed.substring(lastDot + 1) : trimmed;
        return Optional.ofNullable(bare.get(lastSegment));
    }

    public List<VariableSet> sets() {
        return sets;
    }

    public List<String> loadProblems() {
        return loadProblems;
    }

    public int size() {
        return qualified.size();
    }

    public boolean isEmpty() {
        return qualified.isEmpty();
    }
}
