package com.williamcallahan.flarenormalizer.service.finalize;

import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

/**
 * Removes block and inline wrappers left without content after the earlier passes.
 *
 * Runs bottom-up so a parent emptied by removing its children is pruned in the same pass. Audit
 * comments inside a pruned element are moved in front of it.
 */
final class EmptyElementPruner {

    private static final Set<String> PRUNABLE = Set.of(
        "p", "li", "div", "span", "h1", "h2", "h3", "h4", "h5", "h6", "ol", "ul", "dl"
    );
    private static final String CONTENT_BEARING =
        "img, input, select, textarea, iframe, video, audio, object, embed, svg, hr, madcap|variable";

    private EmptyElementPruner() {
    }

    /**
     * @return number of elements removed
     */
    static int apply(Document document) {
        List<Element> elements = new ArrayList<>(document.body().getAllElements());
        Collections.reverse(elements);
        int removed = 0;
        for (Element element : elements) {
            if (element.parent() == null || !PRUNABLE.contains(element.normalName()) || hasContent(element)) {
                continue;
            }
            for (Node node : new ArrayList<>(element.childNodes())) {
                hoistComments(node, element);
            }
            element.remove();
            removed++;
        }
        return removed;
    }

    private static boolean hasContent(Element element) {
        if (!DomNodes.visibleText(element).isBlank()) {
            return true;
        }
        return !element.select(CONTENT_BEARING).isEmpty();
    }

    private static void hoistComments(Node node, Element anchor) {
        if (node instanceof Comment) {
            anchor.before(node);
            return;
        }
        if (node instanceof Element child) {
            for (Node grandChild : new ArrayList<>(child.childNodes())) {
                hoistComments(grandChild, anchor);
            }
        }
    }
}
