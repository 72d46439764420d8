package com.williamcallahan.flarenormalizer.service.finalize;

import com.williamcallahan.flarenormalizer.domain.OutputFormat;
import com.williamcallahan.flarenormalizer.domain.ProcessingWarning;
import com.williamcallahan.flarenormalizer.service.NormalizationRun;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Last pass over a normalized tree: text cleanup, path decoding, empty element pruning and
 * XHTML compliance.
 *
 * The document is switched to XML output syntax so void elements serialize self-closed and
 * boolean attributes keep their value. Every step is idempotent, so finalizing an already
 * finalized tree leaves it unchanged.
 */
@Service
public class StructuralFinalizer {

    private static final Logger log = LoggerFactory.getLogger(StructuralFinalizer.class);
    private static final List<String> PATH_ATTRIBUTES = List.of("src", "href");

    /**
     * Finalizes the document in place.
     *
     * @param document tree to finalize
     * @param run run state receiving decode warnings
     */
    public void finalizeDocument(Document document, NormalizationRun run) {
        if (run.context().outputFormatHint().flattensInlineFormatting()) {
            int flattened = InlineFormattingFlattener.apply(document);
            log.debug("Flattened {} inline formatting element(s) for {}", flattened, OutputFormat.ASCIIDOC);
        }
        cleanText(document);
        decodePathAttributes(document, run);
        int pruned = EmptyElementPruner.apply(document);
        XhtmlComplianceFixer.apply(document);
        document.outputSettings()
            .syntax(Document.OutputSettings.Syntax.xml)
            .escapeMode(Entities.EscapeMode.xhtml);
        if (pruned > 0) {
            log.debug("Pruned {} empty element(s)", pruned);
        }
    }

    private static void cleanText(Document document) {
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                String original = textNode.getWholeText();
                String cleaned = isPreformatted(textNode)
                    ? TextCleaner.cleanPreformatted(original)
                    : TextCleaner.clean(original);
                if (!cleaned.equals(original)) {
                    textNode.text(cleaned);
                }
            }
        }, document.body());
    }

    private static boolean isPreformatted(TextNode textNode) {
        Node ancestor = textNode.parent();
        while (ancestor != null) {
            if ("pre".equals(ancestor.normalName())) {
                return true;
            }
            ancestor = ancestor.parent();
        }
        return false;
    }

    private static void decodePathAttributes(Document document, NormalizationRun run) {
        for (Element element : document.body().getAllElements()) {
            for (String attribute : PATH_ATTRIBUTES) {
                if (!element.hasAttr(attribute)) {
                    continue;
                }
                String raw = element.attr(attribute);
                Optional<String> decoded = PathAttributeDecoder.decode(raw);
                if (decoded.isEmpty()) {
                    run.warn(ProcessingWarning.WarningType.MALFORMED_ATTRIBUTE,
                        "Malformed percent-encoding in " + attribute + " attribute", raw);
                } else if (!decoded.get().equals(raw)) {
                    element.attr(attribute, decoded.get());
                }
            }
        }
    }
}
