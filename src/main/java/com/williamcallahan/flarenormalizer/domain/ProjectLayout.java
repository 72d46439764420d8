package com.williamcallahan.flarenormalizer.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Canonical directories of a MadCap Flare project derived from one of its documents.
 *
 * @param root directory containing {@code Content}
 * @param snippetsDir {@code root/Content/Resources/Snippets}
 * @param variableSetsDir {@code root/Project/VariableSets}
 */
public record ProjectLayout(Path root, Path snippetsDir, Path variableSetsDir) {

    public ProjectLayout {
        Objects.requireNonNull(root, "Project root cannot be null");
        Objects.requireNonNull(snippetsDir, "Snippets directory cannot be null");
        Objects.requireNonNull(variableSetsDir, "Variable sets directory cannot be null");
    }

    /**
     * Derives the canonical layout for a project root.
     *
     * @param root project root
     * @return layout with the standard Flare subdirectories
     */
    public static ProjectLayout forRoot(Path root) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        return new ProjectLayout(
            normalizedRoot,
            normalizedRoot.resolve("Content").resolve("Resources").resolve("Snippets"),
            normalizedRoot.resolve("Project").resolve("VariableSets"));
    }

    /**
     * @return {@code root/Content}
     */
    public Path contentDir() {
        return root.resolve("Content");
    }
}
