package com.williamcallahan.flarenormalizer.service.finalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Replaces inline emphasis and code elements with AsciiDoc markup characters, keeping their
 * child nodes.
 */
final class InlineFormattingFlattener {

    private static final Map<String, String> DELIMITERS = Map.of(
        "i", "_",
        "em", "_",
        "b", "*",
        "strong", "*",
        "code", "`"
    );

    private InlineFormattingFlattener() {
    }

    /**
     * @return number of elements flattened
     */
    static int apply(Document document) {
        List<Element> elements = new ArrayList<>(document.body().getAllElements());
        // innermost first so nested markup is carried into the outer text
        Collections.reverse(elements);
        int flattened = 0;
        for (Element element : elements) {
            String delimiter = DELIMITERS.get(element.normalName());
            if (delimiter == null || element.parent() == null || !element.parents().select("pre").isEmpty()) {
                continue;
            }
            if (!element.text().isBlank()) {
                // delimiters hug the content so "<b> Save </b>" becomes " *Save* "
                element.before(new TextNode(takeLeadingWhitespace(element.childNode(0)) + delimiter));
                element.after(new TextNode(delimiter + takeTrailingWhitespace(element.childNode(element.childNodeSize() - 1))));
            }
            // children such as links and icons stay in place
            element.unwrap();
            flattened++;
        }
        return flattened;
    }

    private static String takeLeadingWhitespace(Node node) {
        if (!(node instanceof TextNode text)) {
            return "";
        }
        String whole = text.getWholeText();
        int start = 0;
        while (start < whole.length() && Character.isWhitespace(whole.charAt(start))) {
            start++;
        }
        text.text(whole.substring(start));
        return whole.substring(0, start);
    }

    private static String takeTrailingWhitespace(Node node) {
        if (!(node instanceof TextNode text)) {
            return "";
        }
        String whole = text.getWholeText();
        int end = whole.length();
        while (end > 0 && Character.isWhitespace(whole.charAt(end - 1))) {
            end--;
        }
        text.text(whole.substring(0, end));
        return whole.substring(end);
    }
}
