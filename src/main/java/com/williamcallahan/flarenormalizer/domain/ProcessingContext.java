package com.williamcallahan.flarenormalizer.domain;

import com.williamcallahan.flarenormalizer.support.AsciiTextNormalizer;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-run options for one normalization call.
 *
 * @param extractVariables emit attribute references and record definitions instead of inlining values
 * @param preserveVariables leave variable elements untouched for a later stage
 * @param outputFormatHint emitter the tree is destined for
 * @param excludeConditions condition names that always remove the tagged element
 * @param includeConditions condition names that keep the tagged element even when the skip taxonomy matches
 */
public record ProcessingContext(
    boolean extractVariables,
    boolean preserveVariables,
    OutputFormat outputFormatHint,
    Set<String> excludeConditions,
    Set<String> includeConditions
) {

    public ProcessingContext {
        outputFormatHint = outputFormatHint == null ? OutputFormat.UNSPECIFIED : outputFormatHint;
        excludeConditions = foldConditionNames(excludeConditions);
        includeConditions = foldConditionNames(includeConditions);
    }

    /**
     * Options that resolve variables inline and apply only the skip taxonomy.
     *
     * @return default processing options
     */
    public static ProcessingContext defaults() {
        return new ProcessingContext(false, false, OutputFormat.UNSPECIFIED, Set.of(), Set.of());
    }

    public ProcessingContext withExtractVariables(boolean extract) {
        return new ProcessingContext(extract, preserveVariables, outputFormatHint, excludeConditions, includeConditions);
    }

    public ProcessingContext withPreserveVariables(boolean preserve) {
        return new ProcessingContext(extractVariables, preserve, outputFormatHint, excludeConditions, includeConditions);
    }

    public ProcessingContext withOutputFormat(OutputFormat format) {
        return new ProcessingContext(extractVariables, preserveVariables, format, excludeConditions, includeConditions);
    }

    public ProcessingContext withConditions(Set<String> exclude, Set<String> include) {
        return new ProcessingContext(extractVariables, preserveVariables, outputFormatHint, exclude, include);
    }

    private static Set<String> foldConditionNames(Set<String> names) {
        if (names == null || names.isEmpty()) {
            return Set.of();
        }
        Set<String> folded = new LinkedHashSet<>();
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                folded.add(AsciiTextNormalizer.foldLabel(name));
            }
        }
        return Set.copyOf(folded);
    }
}
