package com.williamcallahan.flarenormalizer.service.snippets;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.flarenormalizer.config.AppProperties;
import com.williamcallahan.flarenormalizer.domain.ProcessingWarning.WarningType;
import com.williamcallahan.flarenormalizer.domain.ProjectLayout;
import com.williamcallahan.flarenormalizer.service.NormalizationRun;
import com.williamcallahan.flarenormalizer.service.SnippetProcessor;
import com.williamcallahan.flarenormalizer.service.io.FileOperationsService;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Inlines MadCap snippet references.
 *
 * Block snippets ({@code MadCap:snippetBlock}) resolve relative to the document that references
 * them and are spliced in as sibling nodes. Text snippets ({@code MadCap:snippetText}) always
 * live under the project's {@code Content/Resources/Snippets} directory and are spliced in as
 * inline content. Snippet bodies run through the same passes as their host via a
 * {@link SnippetProcessor}, sharing the host's {@link NormalizationRun} so a snippet that
 * includes itself is detected. Missing, unreadable or circular snippets become a labeled
 * placeholder and a warning; they never fail the host document.
 */
@Service
public class SnippetResolver {

    private static final Logger log = LoggerFactory.getLogger(SnippetResolver.class);

    private static final Pattern XML_DECLARATION = Pattern.compile("<\\?xml[^>]*>");
    private static final Pattern MADCAP_NAMESPACE = Pattern.compile("xmlns:MadCap=\"[^\"]*\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_CONTENT = Pattern.compile("<body[^>]*>([\\s\\S]*?)</body>", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_PARENT_SEGMENTS = Pattern.compile("^(\\.\\./)+");
    private static final Pattern LEADING_SNIPPETS_DIR = Pattern.compile("^Snippets/");
    private static final String RESOURCES_SNIPPETS_PREFIX = "Resources/Snippets/";
    private static final Set<String> INLINE_UNWRAP_TAGS = Set.of("p", "div");
    static final String PLACEHOLDER_CLASS = "snippet-placeholder";

    private final FileOperationsService fileOperations;
    private final Cache<SnippetKey, String> bodyCache;

    public SnippetResolver(FileOperationsService fileOperations, AppProperties appProperties) {
        this.fileOperations = fileOperations;
        this.bodyCache = Caffeine.newBuilder()
            .maximumSize(appProperties.getNormalizer().getCache().getSnippetMaxEntries())
            .recordStats()
            .build();
    }

    /**
     * Replaces a block snippet element with the normalized body of the referenced file.
     *
     * @param element the {@code MadCap:snippetBlock} element, attached to a tree
     * @param run state of the enclosing normalization call
     * @param processor normalizes the snippet body
     */
    public void resolveBlock(Element element, NormalizationRun run, SnippetProcessor processor) {
        String src = element.attr("src").trim();
        if (src.isEmpty()) {
            run.warn(WarningType.MALFORMED_MADCAP_ELEMENT, "Snippet block without src attribute", element.tagName());
            element.unwrap();
            return;
        }
        Optional<Path> documentPath = run.currentDocument();
        if (documentPath.isEmpty()) {
            run.warn(WarningType.SNIPPET_NOT_FOUND, "Snippet cannot be resolved without an input path", src);
            replaceWithPlaceholder(element, src, true);
            return;
        }
        Path base = documentPath.get().getParent() == null ? documentPath.get() : documentPath.get().getParent();
        Optional<Path> snippetPath = toPath(base, decode(src));
        if (snippetPath.isEmpty()) {
            run.warn(WarningType.MALFORMED_ATTRIBUTE, "Snippet src is not a valid path", src);
            replaceWithPlaceholder(element, src, true);
            return;
        }
        inline(element, src, snippetPath.get(), run, processor, true);
    }

    /**
     * Replaces a text snippet element with the inline content of the referenced file.
     *
     * @param element the {@code MadCap:snippetText} element, attached to a tree
     * @param run state of the enclosing normalization call
     * @param processor normalizes the snippet body
     */
    public void resolveText(Element element, NormalizationRun run, SnippetProcessor processor) {
        String src = element.attr("src").trim();
        if (src.isEmpty()) {
            run.warn(WarningType.MALFORMED_MADCAP_ELEMENT, "Snippet text without src attribute", element.tagName());
            element.unwrap();
            return;
        }
        Optional<ProjectLayout> layout = run.layout();
        if (layout.isEmpty()) {
            run.warn(WarningType.SNIPPET_NOT_FOUND, "Snippet cannot be resolved without an input path", src);
            replaceWithPlaceholder(element, src, false);
            return;
        }
        Optional<Path> snippetPath = resolveTextSnippetPath(layout.get(), decode(src));
        if (snippetPath.isEmpty()) {
            run.warn(WarningType.MALFORMED_ATTRIBUTE, "Snippet src is not a valid path", src);
            replaceWithPlaceholder(element, src, false);
            return;
        }
        inline(element, src, snippetPath.get(), run, processor, false);
    }

    /**
     * Maps a text snippet reference onto the project's snippet directory, tolerating leading
     * {@code ../} segments and {@code Snippets/} or {@code Resources/Snippets/} prefixes.
     */
    Optional<Path> resolveTextSnippetPath(ProjectLayout layout, String src) {
        String cleaned = LEADING_PARENT_SEGMENTS.matcher(src.replace('\\', '/')).replaceFirst("");
        if (cleaned.startsWith(RESOURCES_SNIPPETS_PREFIX)) {
            return toPath(layout.contentDir(), cleaned);
        }
        cleaned = LEADING_SNIPPETS_DIR.matcher(cleaned).replaceFirst("");
        return toPath(layout.snippetsDir(), cleaned);
    }

    private void inline(Element element, String src, Path snippetPath, NormalizationRun run,
                        SnippetProcessor processor, boolean block) {
        if (run.isLoading(snippetPath)) {
            log.warn("Circular snippet reference detected: {}", snippetPath);
            run.warn(WarningType.CIRCULAR_SNIPPET, "Circular snippet reference detected: " + snippetPath, src);
            replaceWithPlaceholder(element, src, block);
            return;
        }
        String body;
        try {
            body = readBody(snippetPath);
        } catch (IOException e) {
            log.warn("Could not load snippet {}: {}", snippetPath, e.getMessage());
            run.warn(WarningType.SNIPPET_NOT_FOUND, "Could not load snippet " + snippetPath + ": " + e.getMessage(), src);
            replaceWithPlaceholder(element, src, block);
            return;
        }

        List<Node> nodes;
        run.enterSnippet(snippetPath);
        try {
            nodes = processor.process(body, snippetPath, run);
        } finally {
            run.exitSnippet(snippetPath);
        }

        for (Node node : nodes) {
            if (!block && DomNodes.isAnyTag(node, INLINE_UNWRAP_TAGS)) {
                spliceInline((Element) node, element);
            } else {
                element.before(node);
            }
        }
        element.remove();
        log.debug("Inlined {} snippet {}", block ? "block" : "text", snippetPath);
    }

    private static void spliceInline(Element blockWrapper, Element anchor) {
        for (Node child : DomNodes.childNodesSnapshot(blockWrapper)) {
            if (DomNodes.isAnyTag(child, INLINE_UNWRAP_TAGS)) {
                spliceInline((Element) child, anchor);
            } else {
                anchor.before(child);
            }
        }
    }

    private String readBody(Path snippetPath) throws IOException {
        if (!fileOperations.fileExists(snippetPath)) {
            throw new IOException("File not found");
        }
        SnippetKey key = new SnippetKey(snippetPath, Files.getLastModifiedTime(snippetPath).toMillis());
        String cached = bodyCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        String body = extractBody(fileOperations.readCachedTextFile(snippetPath));
        bodyCache.put(key, body);
        return body;
    }

    /**
     * Strips the XML declaration and MadCap namespace and returns the content of {@code <body>},
     * or the whole cleaned content when there is no body element.
     */
    static String extractBody(String rawContent) {
        String cleaned = XML_DECLARATION.matcher(rawContent).replaceAll("");
        cleaned = MADCAP_NAMESPACE.matcher(cleaned).replaceAll("");
        Matcher body = BODY_CONTENT.matcher(cleaned);
        if (body.find()) {
            return body.group(1).trim();
        }
        return cleaned.trim();
    }

    /**
     * Replaces the snippet element with a labeled placeholder that keeps any fallback content the
     * element carried.
     */
    static void replaceWithPlaceholder(Element element, String src, boolean block) {
        Element placeholder;
        if (block) {
            placeholder = new Element("div").addClass(PLACEHOLDER_CLASS);
            Element note = placeholder.appendElement("p");
            note.appendElement("strong").text("Content:");
            note.appendChild(new TextNode(" Snippet from "));
            note.appendElement("code").text(src);
        } else {
            placeholder = new Element("span").addClass(PLACEHOLDER_CLASS);
            placeholder.appendChild(new TextNode("Snippet from "));
            placeholder.appendElement("code").text(src);
        }
        if (!element.text().isBlank()) {
            if (!block) {
                placeholder.appendChild(new TextNode(" "));
            }
            DomNodes.moveChildren(element, placeholder);
        }
        element.replaceWith(placeholder);
    }

    private static String decode(String src) {
        if (src.indexOf('%') < 0) {
            return src;
        }
        try {
            return URLDecoder.decode(src.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException malformed) {
            return src;
        }
    }

    private static Optional<Path> toPath(Path base, String relative) {
        try {
            return Optional.of(base.resolve(relative).toAbsolutePath().normalize());
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private record SnippetKey(Path path, long modifiedMillis) {
    }
}
