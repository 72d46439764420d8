package com.williamcallahan.flarenormalizer.service.lists;

import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores the rule that lists contain only list items.
 *
 * Content found directly inside a list either continues the previous item or starts a new one,
 * depending on whether it reads like a new action step. Paragraphs right after a list that read
 * as continuation move into the list's last item, and list items found outside any list are
 * wrapped in a new {@code ul}.
 */
class OrphanContentRepairer {

    private static final Logger log = LoggerFactory.getLogger(OrphanContentRepairer.class);
    private static final Set<String> ALLOWED_LIST_CHILDREN = Set.of("li", "script", "template");

    private final ContinuationClassifier classifier;

    OrphanContentRepairer(ContinuationClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Moves continuation paragraphs that directly follow top-level lists into the last item.
     */
    int attachFollowingContinuations(Document document) {
        int moved = 0;
        for (Element list : new ArrayList<>(document.select("ol, ul"))) {
            if (list.parent() == null || ListReconstructor.isProcessed(list) || DomNodes.isTag(list.parent(), "li")) {
                continue;
            }
            Element lastItem = SiblingListAbsorber.lastItem(list);
            if (lastItem == null) {
                continue;
            }
            Element next = list.nextElementSibling();
            while (next != null && DomNodes.isTag(next, "p")
                    && classifier.isContinuationContent(next, DomNodes.visibleText(next))) {
                Element following = next.nextElementSibling();
                lastItem.appendChild(next);
                moved++;
                next = following;
            }
        }
        return moved;
    }

    /**
     * Wraps or relocates every non-item child of every list.
     */
    int repairListChildren(Document document) {
        int repaired = 0;
        for (Element list : new ArrayList<>(document.select("ol, ul"))) {
            if (list.parent() != null && !ListReconstructor.isProcessed(list)) {
                repaired += repairList(list);
            }
        }
        return repaired;
    }

    private int repairList(Element list) {
        int repaired = 0;
        Element lastItem = null;
        for (Node child : DomNodes.childNodesSnapshot(list)) {
            if (child instanceof Comment) {
                continue;
            }
            if (child instanceof TextNode textNode) {
                if (!DomNodes.hasVisibleText(textNode)) {
                    textNode.remove();
                    continue;
                }
                lastItem = placeOrphan(list, child, textNode.getWholeText().trim(), lastItem);
                repaired++;
                continue;
            }
            if (!(child instanceof Element element)) {
                child.remove();
                continue;
            }
            if (ALLOWED_LIST_CHILDREN.contains(element.normalName())) {
                if (element.normalName().equals("li")) {
                    lastItem = element;
                }
                continue;
            }
            if (DomNodes.isList(element)) {
                if (lastItem != null) {
                    lastItem.appendChild(element);
                } else {
                    lastItem = wrapInNewItem(element);
                }
            } else {
                lastItem = placeOrphan(list, element, DomNodes.visibleText(element), lastItem);
            }
            repaired++;
        }
        return repaired;
    }

    private Element placeOrphan(Element list, Node orphan, String text, Element lastItem) {
        if (lastItem != null && !classifier.looksLikeActionItem(text)) {
            lastItem.appendChild(orphan);
            log.debug("Attached orphaned list content to previous item in <{}>", list.tagName());
            return lastItem;
        }
        return wrapInNewItem(orphan);
    }

    private static Element wrapInNewItem(Node orphan) {
        Element item = new Element("li");
        orphan.before(item);
        item.appendChild(orphan);
        return item;
    }

    /**
     * Wraps runs of list items that are not inside a list in a new {@code ul}.
     */
    int wrapStrayItems(Document document) {
        int wrapped = 0;
        for (Element item : new ArrayList<>(document.getElementsByTag("li"))) {
            Element parent = item.parent();
            if (parent == null || DomNodes.isList(parent) || DomNodes.isTag(parent, "menu")) {
                continue;
            }
            Element list = new Element("ul");
            item.before(list);
            List<Node> run = new ArrayList<>();
            run.add(item);
            Node next = item.nextSibling();
            while (next != null && (DomNodes.isTag(next, "li") || isBlankText(next))) {
                run.add(next);
                next = next.nextSibling();
            }
            while (isBlankText(run.get(run.size() - 1))) {
                run.remove(run.size() - 1);
            }
            for (Node member : run) {
                if (member instanceof Element) {
                    list.appendChild(member);
                } else {
                    member.remove();
                }
            }
            wrapped++;
        }
        return wrapped;
    }

    private static boolean isBlankText(Node node) {
        return node instanceof TextNode textNode && !DomNodes.hasVisibleText(textNode);
    }
}
