package com.williamcallahan.flarenormalizer.service.lists;

import com.williamcallahan.flarenormalizer.support.AsciiTextNormalizer;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.List;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;

/**
 * Decides whether a list that MadCap exported next to a list item is really that item's sub-list.
 */
public class ListNestingHeuristics {

    private static final Pattern INTRODUCES_SUBLIST =
        Pattern.compile("\\b(include|contains|such as|following|these|consist|comprise|on the|page)\\b");
    private static final List<String> INTRODUCTORY_PHRASES = List.of(
        "follow these steps", "following steps", "do the following", "as follows",
        "includes", "contains", "consists of", "comprised of");

    /**
     * Marker style of a list, from its {@code list-style-type} or legacy {@code type}.
     */
    enum MarkerStyle {
        LOWER_ALPHA,
        UPPER_ALPHA,
        LOWER_ROMAN,
        UPPER_ROMAN,
        OTHER
    }

    private final int largeListThreshold;

    public ListNestingHeuristics(int largeListThreshold) {
        this.largeListThreshold = largeListThreshold;
    }

    /**
     * Decides whether {@code candidate}, the next element sibling run after {@code listItem},
     * should become a child of the item.
     */
    public boolean shouldNestSiblingList(Element listItem, Element candidate) {
        for (Element sibling = listItem.nextElementSibling(); sibling != null && sibling != candidate;
             sibling = sibling.nextElementSibling()) {
            if (DomNodes.isHeading(sibling)) {
                return false;
            }
        }

        Element parentList = listItem.parent();
        if (impliesHierarchy(parentList, candidate)) {
            return true;
        }

        String candidateClass = candidate.className();
        if (candidateClass.contains("sub-list") || candidateClass.contains("nested")) {
            return true;
        }

        if (isLargeIndependentList(parentList, candidate)) {
            return false;
        }

        String itemText = AsciiTextNormalizer.toLowerAscii(DomNodes.visibleText(listItem));
        return INTRODUCES_SUBLIST.matcher(itemText).find()
            || itemText.endsWith(":")
            || itemText.endsWith(";")
            || itemText.contains("step");
    }

    /**
     * Style-based hierarchy: lower-alpha nests under a numbered list, lower-roman under
     * lower-alpha, upper-alpha under a list that is neither alphabetic nor roman.
     */
    public boolean impliesHierarchy(Element parentList, Element candidate) {
        MarkerStyle candidateStyle = markerStyle(candidate);
        MarkerStyle parentStyle = parentList == null ? MarkerStyle.OTHER : markerStyle(parentList);
        switch (candidateStyle) {
            case LOWER_ALPHA:
                return parentStyle != MarkerStyle.LOWER_ALPHA && parentStyle != MarkerStyle.LOWER_ROMAN;
            case LOWER_ROMAN:
                return parentStyle == MarkerStyle.LOWER_ALPHA;
            case UPPER_ALPHA:
                return parentStyle != MarkerStyle.LOWER_ALPHA
                    && parentStyle != MarkerStyle.UPPER_ALPHA
                    && parentStyle != MarkerStyle.LOWER_ROMAN;
            default:
                return false;
        }
    }

    /**
     * A list with many items directly under {@code body} reads as its own section.
     */
    public boolean isLargeIndependentList(Element parentList, Element candidate) {
        if (parentList == null || parentList.parent() == null) {
            return false;
        }
        return parentList.parent().normalName().equals("body")
            && candidate.getElementsByTag("li").size() >= largeListThreshold;
    }

    /**
     * Decides whether a list item's own text introduces the list that follows it.
     */
    public boolean shouldNestList(Element listItem) {
        List<Element> blocks = listItem.select("p, div");
        String introText;
        if (!blocks.isEmpty()) {
            introText = DomNodes.visibleText(blocks.get(blocks.size() - 1));
        } else {
            introText = DomNodes.directText(listItem);
        }
        if (introText.endsWith(":")) {
            return true;
        }
        String itemText = AsciiTextNormalizer.toLowerAscii(DomNodes.visibleText(listItem));
        for (String phrase : INTRODUCTORY_PHRASES) {
            if (itemText.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    static MarkerStyle markerStyle(Element list) {
        String style = AsciiTextNormalizer.toLowerAscii(list.attr("style"));
        if (style.contains("lower-alpha") || style.contains("lower-latin")) {
            return MarkerStyle.LOWER_ALPHA;
        }
        if (style.contains("upper-alpha") || style.contains("upper-latin")) {
            return MarkerStyle.UPPER_ALPHA;
        }
        if (style.contains("lower-roman")) {
            return MarkerStyle.LOWER_ROMAN;
        }
        if (style.contains("upper-roman")) {
            return MarkerStyle.UPPER_ROMAN;
        }
        switch (list.attr("type").trim()) {
            case "a":
                return MarkerStyle.LOWER_ALPHA;
            case "A":
                return MarkerStyle.UPPER_ALPHA;
            case "i":
                return MarkerStyle.LOWER_ROMAN;
            case "I":
                return MarkerStyle.UPPER_ROMAN;
            default:
                return MarkerStyle.OTHER;
        }
    }

    static boolean isStyledSubList(Element list) {
        MarkerStyle style = markerStyle(list);
        return style == MarkerStyle.LOWER_ALPHA || style == MarkerStyle.LOWER_ROMAN || style == MarkerStyle.UPPER_ALPHA;
    }
}
