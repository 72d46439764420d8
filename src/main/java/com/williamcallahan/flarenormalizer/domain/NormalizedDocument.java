package com.williamcallahan.flarenormalizer.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jsoup.nodes.Document;

/**
 * Result of normalizing one MadCap source document.
 *
 * @param document the normalized tree, owned by the caller from here on
 * @param warnings recoverable problems encountered, in the order they occurred
 * @param extractedVariables variable definitions recorded in extract mode
 * @param inputPath the source path when the document came from a project file
 */
public record NormalizedDocument(
    Document document,
    List<ProcessingWarning> warnings,
    List<ExtractedVariable> extractedVariables,
    Path inputPath
) {

    public NormalizedDocument {
        Objects.requireNonNull(document, "Document cannot be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        extractedVariables = extractedVariables == null ? List.of() : List.copyOf(extractedVariables);
    }

    /**
     * Returns the serialized body content of the normalized tree.
     *
     * @return body inner HTML
     */
    public String html() {
        return document.body().html();
    }

    /**
     * Checks if normalization completed without warnings.
     * @return true if no warnings were generated
     */
    public boolean isClean() {
        return warnings.isEmpty();
    }

    public Optional<Path> source() {
        return Optional.ofNullable(inputPath);
    }
}
