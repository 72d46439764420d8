package com.williamcallahan.flarenormalizer.domain;

import java.util.List;
import java.util.Map;

/**
 * Conditions found across a set of source files.
 *
 * @param conditions distinct condition names, sorted
 * @param analyzedFileCount number of HTML files inspected
 * @param usage number of files using each condition
 * @param filesByCondition files that use each condition, sorted
 * @param details per-condition classification, in {@code conditions} order
 */
public record ConditionAnalysis(
    List<String> conditions,
    int analyzedFileCount,
    Map<String, Integer> usage,
    Map<String, List<String>> filesByCondition,
    List<ConditionInfo> details
) {

    public ConditionAnalysis {
        conditions = List.copyOf(conditions);
        usage = Map.copyOf(usage);
        filesByCondition = Map.copyOf(filesByCondition);
        details = List.copyOf(details);
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }
}
