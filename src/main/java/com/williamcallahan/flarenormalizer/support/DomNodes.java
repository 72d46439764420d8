package com.williamcallahan.flarenormalizer.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Small helpers over jsoup nodes shared by the rewrite passes.
 *
 * Tag comparisons go through {@link Element#normalName()}, so {@code MadCap:xref} and
 * {@code madcap:XREF} are the same tag while the parsed tree keeps the author's spelling.
 */
public final class DomNodes {

    /** Elements that never carry children. */
    public static final Set<String> VOID_ELEMENTS = Set.of(
            "br", "hr", "img", "input", "meta", "link", "area", "base", "col", "embed", "source", "track", "wbr");

    private static final Set<String> HEADINGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");

    private DomNodes() {
        // Utility class - no instantiation
    }

    public static boolean isTag(Node node, String tag) {
        return node instanceof Element element && element.normalName().equals(tag);
    }

    public static boolean isAnyTag(Node node, Set<String> tags) {
        return node instanceof Element element && tags.contains(element.normalName());
    }

    public static boolean isList(Node node) {
        return isTag(node, "ol") || isTag(node, "ul");
    }

    public static boolean isHeading(Node node) {
        return isAnyTag(node, HEADINGS);
    }

    public static boolean isVoid(Element element) {
        return VOID_ELEMENTS.contains(element.normalName());
    }

    /**
     * Copies the child node list so callers can restructure the parent while iterating.
     */
    public static List<Node> childNodesSnapshot(Element element) {
        return new ArrayList<>(element.childNodes());
    }

    /**
     * Returns whether a text node holds anything other than whitespace, treating no-break
     * spaces as whitespace.
     */
    public static boolean hasVisibleText(TextNode textNode) {
        return !textNode.getWholeText().replace('\u00A0', ' ').isBlank();
    }

    /**
     * Joins the element's direct text children, ignoring text inside descendant elements.
     */
    public static String directText(Element element) {
        StringBuilder text = new StringBuilder();
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode textNode) {
                text.append(textNode.getWholeText()).append(' ');
            }
        }
        return text.toString().replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    /**
     * Returns the element's trimmed visible text with no-break spaces folded into spaces.
     */
    public static String visibleText(Element element) {
        return element.text().replace('\u00A0', ' ').trim();
    }

    /**
     * Reads an integer attribute, returning {@code fallback} when absent or malformed.
     */
    public static int intAttribute(Element element, String attribute, int fallback) {
        String raw = element.attr(attribute).trim();
        if (raw.isEmpty()) {
            return fallback;
        }
        int end = 0;
        while (end < raw.length() && Character.isDigit(raw.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.substring(0, end));
        } catch (NumberFormatException overflow) {
            return fallback;
        }
    }

    /**
     * Moves every child of {@code source} to the end of {@code target}, preserving order.
     */
    public static void moveChildren(Element source, Element target) {
        for (Node child : childNodesSnapshot(source)) {
            target.appendChild(child);
        }
    }
}
