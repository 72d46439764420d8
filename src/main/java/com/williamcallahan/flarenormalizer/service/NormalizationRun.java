package com.williamcallahan.flarenormalizer.service;

import com.williamcallahan.flarenormalizer.domain.ExtractedVariable;
import com.williamcallahan.flarenormalizer.domain.ProcessingContext;
import com.williamcallahan.flarenormalizer.domain.ProcessingWarning;
import com.williamcallahan.flarenormalizer.domain.ProjectLayout;
import com.williamcallahan.flarenormalizer.service.variables.ProjectVariables;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one top-level normalization call.
 *
 * A run is created fresh for every {@code preprocess} call and shared by the nested passes over
 * snippet content, so warnings, extracted variables and the set of snippets currently being
 * loaded all belong to exactly one call. Not thread-safe; a run is confined to the thread
 * normalizing its document.
 */
public final class NormalizationRun {

    private final ProcessingContext context;
    private final ProjectLayout layout;
    private final ProjectVariables variables;
    private final Deque<Path> documentPaths = new ArrayDeque<>();
    private final Set<Path> loadingSnippets = new LinkedHashSet<>();
    private final List<ProcessingWarning> warnings = new ArrayList<>();
    private final Map<String, ExtractedVariable> extractedVariables = new LinkedHashMap<>();

    /**
     * Creates run state for one document.
     *
     * @param context processing options
     * @param inputPath source document path, null for raw strings
     * @param layout project directories, null when there is no project context
     * @param variables variable sets of the project
     */
    public NormalizationRun(ProcessingContext context, Path inputPath, ProjectLayout layout,
                            ProjectVariables variables) {
        this.context = Objects.requireNonNull(context, "Processing context cannot be null");
        this.layout = layout;
        this.variables = variables == null ? ProjectVariables.empty() : variables;
        if (inputPath != null) {
            documentPaths.push(inputPath.toAbsolutePath().normalize());
        }
    }

    public ProcessingContext context() {
        return context;
    }

    public Optional<ProjectLayout> layout() {
        return Optional.ofNullable(layout);
    }

    public ProjectVariables variables() {
        return variables;
    }

    /**
     * Returns the document whose markup is currently being processed, the innermost snippet
     * while snippet content is being normalized.
     */
    public Optional<Path> currentDocument() {
        return Optional.ofNullable(documentPaths.peek());
    }

    /**
     * Marks a snippet as loading.
     *
     * @param snippetPath normalized absolute snippet path
     * @return false when the snippet is already being loaded further up the include chain
     */
    public boolean enterSnippet(Path snippetPath) {
        if (!loadingSnippets.add(snippetPath)) {
            return false;
        }
        documentPaths.push(snippetPath);
        return true;
    }

    /**
     * Ends a snippet started with {@link #enterSnippet(Path)}.
     */
    public void exitSnippet(Path snippetPath) {
        loadingSnippets.remove(snippetPath);
        if (snippetPath.equals(documentPaths.peek())) {
            documentPaths.pop();
        }
    }

    public boolean isLoading(Path snippetPath) {
        return loadingSnippets.contains(snippetPath);
    }

    public void warn(ProcessingWarning.WarningType type, String message, String source) {
        warnings.add(new ProcessingWarning(type, message, source));
    }

    public List<ProcessingWarning> warnings() {
        return List.copyOf(warnings);
    }

    /**
     * Records a variable emitted as an attribute reference. The first definition of a name wins.
     */
    public void recordVariable(String name, String value) {
        extractedVariables.putIfAbsent(name, new ExtractedVariable(name, value));
    }

    public List<ExtractedVariable> extractedVariables() {
        return List.copyOf(extractedVariables.values());
    }
}
