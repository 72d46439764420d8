package com.williamcallahan.flarenormalizer.service.lists;

import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves sub-lists that MadCap exported as siblings into the list item they belong to.
 */
class SiblingListAbsorber {

    private static final Logger log = LoggerFactory.getLogger(SiblingListAbsorber.class);

    private final ListNestingHeuristics heuristics;

    SiblingListAbsorber(ListNestingHeuristics heuristics) {
        this.heuristics = heuristics;
    }

    int absorb(Document document) {
        int moved = absorbListsAfterIntroducingItems(document);
        moved += absorbListsAcrossParagraphs(document);
        moved += absorbListsNextToItems(document);
        moved += absorbTrailingOrphanItems(document);
        return moved;
    }

    /**
     * A list whose previous sibling is a list ending in an item like "Do the following:" nests
     * under that item.
     */
    private int absorbListsAfterIntroducingItems(Document document) {
        int moved = 0;
        for (Element list : lists(document)) {
            if (ListReconstructor.isProcessed(list) || isDetached(list) || DomNodes.isTag(list.parent(), "li")) {
                continue;
            }
            Element previous = list.previousElementSibling();
            if (previous == null || !DomNodes.isList(previous) || ListReconstructor.isProcessed(previous)) {
                continue;
            }
            Element lastItem = lastItem(previous);
            if (lastItem != null && heuristics.shouldNestList(lastItem)) {
                lastItem.appendChild(list);
                log.debug("Nested list under introducing item '{}'", abbreviate(lastItem));
                moved++;
            }
        }
        return moved;
    }

    /**
     * A sub-list separated from its parent list by paragraphs nests under the parent's last
     * item together with those paragraphs, keeping their order.
     */
    private int absorbListsAcrossParagraphs(Document document) {
        int moved = 0;
        for (Element list : lists(document)) {
            if (ListReconstructor.isProcessed(list) || isDetached(list) || DomNodes.isTag(list.parent(), "li")) {
                continue;
            }
            List<Element> between = new ArrayList<>();
            Element previous = list.previousElementSibling();
            while (previous != null && (DomNodes.isTag(previous, "p") || DomNodes.isTag(previous, "div"))) {
                between.add(0, previous);
                previous = previous.previousElementSibling();
            }
            if (between.isEmpty() || previous == null || !DomNodes.isList(previous)
                    || ListReconstructor.isProcessed(previous)) {
                continue;
            }
            Element lastItem = lastItem(previous);
            if (lastItem == null || !nestsAcrossParagraphs(previous, lastItem, list)) {
                continue;
            }
            for (Element paragraph : between) {
                lastItem.appendChild(paragraph);
            }
            lastItem.appendChild(list);
            log.debug("Nested list and {} paragraph(s) under item '{}'", between.size(), abbreviate(lastItem));
            moved++;
        }
        return moved;
    }

    private boolean nestsAcrossParagraphs(Element parentList, Element lastItem, Element candidate) {
        if (heuristics.isLargeIndependentList(parentList, candidate)) {
            return false;
        }
        String candidateClass = candidate.className();
        return heuristics.impliesHierarchy(parentList, candidate)
            || candidateClass.contains("sub-list")
            || candidateClass.contains("nested")
            || heuristics.shouldNestList(lastItem);
    }

    /**
     * Handles a list directly next to an {@code li} inside the same parent list, and a styled
     * sub-list directly after the parent list of a last item.
     */
    private int absorbListsNextToItems(Document document) {
        int moved = 0;
        for (Element item : new ArrayList<>(document.getElementsByTag("li"))) {
            if (isDetached(item)) {
                continue;
            }
            Element parentList = item.parent();
            if (parentList != null && ListReconstructor.isProcessed(parentList)) {
                continue;
            }

            Element next = item.nextElementSibling();
            if (next != null && DomNodes.isList(next) && !ListReconstructor.isProcessed(next)
                    && heuristics.shouldNestSiblingList(item, next)) {
                item.appendChild(next);
                log.debug("Nested sibling list under item '{}'", abbreviate(item));
                moved++;
            }

            if (parentList != null && DomNodes.isList(parentList) && item.nextElementSibling() == null) {
                Element afterParent = parentList.nextElementSibling();
                if (afterParent != null && DomNodes.isList(afterParent) && !ListReconstructor.isProcessed(afterParent)
                        && ListNestingHeuristics.isStyledSubList(afterParent)
                        && heuristics.impliesHierarchy(parentList, afterParent)
                        && !heuristics.isLargeIndependentList(parentList, afterParent)) {
                    item.appendChild(afterParent);
                    log.debug("Nested styled list following parent list under item '{}'", abbreviate(item));
                    moved++;
                }
            }
        }
        return moved;
    }

    /**
     * List items stranded right after a list rejoin that list.
     */
    private int absorbTrailingOrphanItems(Document document) {
        int moved = 0;
        for (Element list : lists(document)) {
            if (isDetached(list) || ListReconstructor.isProcessed(list)) {
                continue;
            }
            Element next = list.nextElementSibling();
            while (next != null && DomNodes.isTag(next, "li")) {
                Element following = next.nextElementSibling();
                list.appendChild(next);
                moved++;
                next = following;
            }
        }
        return moved;
    }

    private static List<Element> lists(Document document) {
        return new ArrayList<>(document.select("ol, ul"));
    }

    static Element lastItem(Element list) {
        Element last = null;
        for (Element child : list.children()) {
            if (child.normalName().equals("li")) {
                last = child;
            }
        }
        return last;
    }

    private static boolean isDetached(Element element) {
        return element.parent() == null || element.ownerDocument() == null;
    }

    private static String abbreviate(Element item) {
        String text = DomNodes.directText(item);
        return text.length() > 40 ? text.substring(0, 40) + "..." : text;
    }
}
