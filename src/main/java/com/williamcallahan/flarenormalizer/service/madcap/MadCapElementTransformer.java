package com.williamcallahan.flarenormalizer.service.madcap;

import com.williamcallahan.flarenormalizer.service.NormalizationRun;
import com.williamcallahan.flarenormalizer.service.SnippetProcessor;
import com.williamcallahan.flarenormalizer.service.snippets.SnippetResolver;
import com.williamcallahan.flarenormalizer.support.AsciiTextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rewrites MadCap-specific elements into portable HTML.
 *
 * Elements are classified by tag in one traversal and handled in document order: snippets are
 * inlined, dropdowns become titled containers, cross-references become anchors and variables
 * become text. Continued ordered lists are then numbered, styling classes re-tagged, and MadCap
 * bookkeeping attributes removed. A malformed construct degrades to a placeholder with a warning
 * and never stops the rest of the document.
 */
@Service
public class MadCapElementTransformer {

    private static final Logger log = LoggerFactory.getLogger(MadCapElementTransformer.class);

    private static final Set<String> SNIPPET_BLOCK_TAGS = Set.of("madcap:snippetblock", "madcap:snippet");
    private static final String SNIPPET_TEXT_TAG = "madcap:snippettext";
    private static final String DROPDOWN_TAG = "madcap:dropdown";
    private static final String XREF_TAG = "madcap:xref";
    private static final Set<String> BOOKKEEPING_ATTRIBUTES = Set.of(
        "madcap:conditions", "madcap:continue", "madcap:targetname", "madcap:ignoretag",
        "madcap:exclude", "madcap:html5video");
    private static final String PARAM_ATTRIBUTE_PREFIX = "madcap:param_";

    private final SnippetResolver snippetResolver;
    private final DropdownRewriter dropdownRewriter = new DropdownRewriter();
    private final CrossReferenceRewriter crossReferenceRewriter = new CrossReferenceRewriter();
    private final VariableRewriter variableRewriter = new VariableRewriter();
    private final ContinuedListNumberer continuedListNumberer = new ContinuedListNumberer();
    private final SemanticClassRewriter semanticClassRewriter = new SemanticClassRewriter();

    public MadCapElementTransformer(SnippetResolver snippetResolver) {
        this.snippetResolver = snippetResolver;
    }

    /**
     * Transforms every MadCap construct in the document in place.
     *
     * @param document tree to rewrite
     * @param run state of the enclosing normalization call
     * @param snippetProcessor normalizes inlined snippet bodies
     */
    public void transform(Document document, NormalizationRun run, SnippetProcessor snippetProcessor) {
        List<Element> elements = new ArrayList<>(document.getAllElements());
        int rewritten = 0;
        for (Element element : elements) {
            if (element.parent() == null || element.ownerDocument() == null) {
                continue;
            }
            String tag = element.normalName();
            if (SNIPPET_BLOCK_TAGS.contains(tag)) {
                snippetResolver.resolveBlock(element, run, snippetProcessor);
            } else if (SNIPPET_TEXT_TAG.equals(tag)) {
                snippetResolver.resolveText(element, run, snippetProcessor);
            } else if (DROPDOWN_TAG.equals(tag)) {
                dropdownRewriter.rewrite(element, run);
            } else if (XREF_TAG.equals(tag)) {
                crossReferenceRewriter.rewriteXref(element);
            } else if ("a".equals(tag)) {
                crossReferenceRewriter.rewriteAnchor(element);
                continue;
            } else if (VariableRewriter.isVariable(element)) {
                variableRewriter.rewrite(element, run);
            } else {
                continue;
            }
            rewritten++;
        }

        continuedListNumberer.number(document);
        semanticClassRewriter.rewrite(document);
        removeBookkeepingAttributes(document);
        log.debug("Rewrote {} MadCap element(s)", rewritten);
    }

    private static void removeBookkeepingAttributes(Document document) {
        for (Element element : document.getAllElements()) {
            List<String> doomed = new ArrayList<>();
            for (Attribute attribute : element.attributes()) {
                String key = AsciiTextNormalizer.toLowerAscii(attribute.getKey());
                if (BOOKKEEPING_ATTRIBUTES.contains(key) || key.startsWith(PARAM_ATTRIBUTE_PREFIX)) {
                    doomed.add(attribute.getKey());
                }
            }
            doomed.forEach(element::removeAttr);
        }
    }
}
