package com.williamcallahan.flarenormalizer.config;

import java.util.Locale;

/**
 * Cache bounds for file contents, resolved snippets and per-project variable sets.
 */
public class NormalizerCacheConfig {

    private static final int FILE_CONTENT_DEF = 500;
    private static final int SNIPPET_DEF = 1000;
    private static final int VARIABLE_PROJECT_DEF = 64;
    private static final String FILE_CONTENT_KEY = "app.normalizer.cache.file-content-max-entries";
    private static final String SNIPPET_KEY = "app.normalizer.cache.snippet-max-entries";
    private static final String VARIABLE_PROJECT_KEY = "app.normalizer.cache.variable-project-max-entries";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int fileContentMaxEntries = FILE_CONTENT_DEF;
    private int snippetMaxEntries = SNIPPET_DEF;
    private int variableProjectMaxEntries = VARIABLE_PROJECT_DEF;

    /**
     * Validates cache bounds.
     */
    public void validateConfiguration() {
        requirePositive(FILE_CONTENT_KEY, fileContentMaxEntries);
        requirePositive(SNIPPET_KEY, snippetMaxEntries);
        requirePositive(VARIABLE_PROJECT_KEY, variableProjectMaxEntries);
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    /**
     * Returns the maximum number of cached file contents.
     *
     * @return maximum number of cached file contents
     */
    public int getFileContentMaxEntries() {
        return fileContentMaxEntries;
    }

    public void setFileContentMaxEntries(final int fileContentMaxEntries) {
        this.fileContentMaxEntries = fileContentMaxEntries;
    }

    /**
     * Returns the maximum number of cached snippet bodies.
     *
     * @return maximum number of cached snippet bodies
     */
    public int getSnippetMaxEntries() {
        return snippetMaxEntries;
    }

    public void setSnippetMaxEntries(final int snippetMaxEntries) {
        this.snippetMaxEntries = snippetMaxEntries;
    }

    /**
     * Returns the maximum number of projects whose variable sets stay cached.
     *
     * @return maximum number of cached projects
     */
    public int getVariableProjectMaxEntries() {
        return variableProjectMaxEntries;
    }

    public void setVariableProjectMaxEntries(final int variableProjectMaxEntries) {
        this.variableProjectMaxEntries = variableProjectMaxEntries;
    }
}
