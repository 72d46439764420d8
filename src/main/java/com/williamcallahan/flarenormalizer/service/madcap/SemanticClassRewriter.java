package com.williamcallahan.flarenormalizer.service.madcap;

import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Re-tags MadCap styling classes as the semantic elements emitters understand: notes and warnings
 * become classed blockquotes, {@code mc-heading-N} becomes {@code hN}, {@code mc-procedure}
 * becomes an ordered list. Table and list structure elements keep their tag.
 */
final class SemanticClassRewriter {

    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final int DEFAULT_HEADING_LEVEL = 2;
    private static final Set<String> STRUCTURAL_TAGS =
        Set.of("li", "ol", "ul", "dl", "dt", "dd", "table", "thead", "tbody", "tfoot", "tr", "td", "th", "body", "html");

    void rewrite(Document document) {
        for (Element element : document.body().getAllElements()) {
            if (element == document.body() || element.parent() == null || STRUCTURAL_TAGS.contains(element.normalName())) {
                continue;
            }
            Set<String> classes = element.classNames();
            if (isNote(element, classes)) {
                retag(element, "blockquote", "note");
            } else if (isWarning(element, classes)) {
                retag(element, "blockquote", "warning");
            } else if (element.className().contains("mc-heading")) {
                retag(element, "h" + headingLevel(element.className()), null);
            } else if (element.className().contains("mc-procedure")) {
                retag(element, "ol", null);
            }
        }
    }

    private static boolean isNote(Element element, Set<String> classes) {
        return classes.contains("note") || element.className().contains("mc-note");
    }

    private static boolean isWarning(Element element, Set<String> classes) {
        return classes.contains("warning") || classes.contains("attention") || element.className().contains("mc-warning");
    }

    static int headingLevel(String className) {
        Matcher digits = DIGITS.matcher(className);
        int level = DEFAULT_HEADING_LEVEL;
        if (digits.find()) {
            try {
                level = Integer.parseInt(digits.group(1));
            } catch (NumberFormatException overflow) {
                level = DEFAULT_HEADING_LEVEL;
            }
        }
        return Math.max(1, Math.min(level, 6));
    }

    private static void retag(Element element, String tag, String className) {
        Element replacement = new Element(tag);
        if (element.hasAttr("id")) {
            replacement.attr("id", element.attr("id"));
        }
        if (className != null) {
            replacement.attr("class", className);
        }
        DomNodes.moveChildren(element, replacement);
        element.replaceWith(replacement);
    }
}
