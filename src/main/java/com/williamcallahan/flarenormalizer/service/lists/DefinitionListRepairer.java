package com.williamcallahan.flarenormalizer.service.lists;

import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.Set;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Makes every child of a {@code dl} a {@code dt} or {@code dd}.
 *
 * A stray child becomes a term when it opens the list or follows a description, otherwise a
 * description. Bare text becomes a description.
 */
class DefinitionListRepairer {

    private static final Set<String> UNWRAPPED_BLOCKS = Set.of("p", "div");

    int repair(Document document) {
        int repaired = 0;
        for (Element list : document.getElementsByTag("dl")) {
            String previous = null;
            for (Node child : DomNodes.childNodesSnapshot(list)) {
                if (child instanceof Comment) {
                    continue;
                }
                if (child instanceof TextNode textNode) {
                    if (!DomNodes.hasVisibleText(textNode)) {
                        textNode.remove();
                        continue;
                    }
                    wrap(child, "dd");
                    previous = "dd";
                    repaired++;
                    continue;
                }
                if (!(child instanceof Element element)) {
                    child.remove();
                    continue;
                }
                String tag = element.normalName();
                if (tag.equals("dt") || tag.equals("dd")) {
                    previous = tag;
                    continue;
                }
                String replacement = previous == null || previous.equals("dd") ? "dt" : "dd";
                if (UNWRAPPED_BLOCKS.contains(tag)) {
                    Element converted = new Element(replacement);
                    DomNodes.moveChildren(element, converted);
                    element.replaceWith(converted);
                } else {
                    wrap(element, replacement);
                }
                previous = replacement;
                repaired++;
            }
        }
        return repaired;
    }

    private static void wrap(Node node, String tag) {
        Element wrapper = new Element(tag);
        node.before(wrapper);
        wrapper.appendChild(node);
    }
}
