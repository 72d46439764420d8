package com.williamcallahan.flarenormalizer.service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Signals that a whole document could not be normalized.
 */
public class DocumentNormalizationException extends IllegalStateException {

    private final transient Path inputPath;

    /**
     * Creates a normalization exception for a document with a known source path.
     *
     * @param message failure summary
     * @param inputPath source path, may be null for raw strings
     * @param cause the underlying failure
     */
    public DocumentNormalizationException(String message, Path inputPath, Throwable cause) {
        super(message, cause);
        this.inputPath = inputPath;
    }

    public DocumentNormalizationException(String message, Path inputPath) {
        this(message, inputPath, null);
    }

    public Optional<Path> getInputPath() {
        return Optional.ofNullable(inputPath);
    }
}
