package com.williamcallahan.flarenormalizer.service;

import java.nio.file.Path;
import java.util.List;
import org.jsoup.nodes.Node;

/**
 * Runs snippet content through the same passes as its host document.
 */
@FunctionalInterface
public interface SnippetProcessor {

    /**
     * Normalizes a snippet body and returns its top-level nodes, detached from any tree.
     *
     * @param bodyHtml snippet body markup
     * @param snippetPath file the snippet was read from
     * @param run the enclosing run, shared so cycles and warnings propagate
     * @return normalized nodes ready to splice into the host
     */
    List<Node> process(String bodyHtml, Path snippetPath, NormalizationRun run);
}
