package com.williamcallahan.flarenormalizer.service;

import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * Parses MadCap source markup into a lenient HTML tree.
 *
 * Tag case is preserved so {@code MadCap:xref} survives as written while attribute names are
 * lower-cased. Before parsing, self-closing MadCap tags are expanded into open/close pairs, since
 * the HTML parser would otherwise treat {@code <MadCap:variable ... />} as an open tag swallowing
 * the rest of the paragraph.
 */
@Component
public class MadCapSourceParser {

    private static final Pattern XML_DECLARATION = Pattern.compile("<\\?xml[^>]*\\?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern SELF_CLOSING_MADCAP =
            Pattern.compile("<(MadCap:[\\w.\\-]+)((?:\\s[^<>]*?)?)\\s*/>", Pattern.CASE_INSENSITIVE);
    private static final Set<String> NON_CONTENT_ELEMENTS = Set.of("script", "style", "noscript", "meta", "link", "base");

    /**
     * Expands self-closing MadCap tags and removes XML declarations.
     *
     * @param rawHtml source markup
     * @return markup ready for the HTML parser
     */
    public String sanitize(String rawHtml) {
        String withoutDeclaration = XML_DECLARATION.matcher(rawHtml).replaceAll("");
        return SELF_CLOSING_MADCAP.matcher(withoutDeclaration).replaceAll("<$1$2></$1>");
    }

    /**
     * Sanitizes and parses source markup, dropping elements that never carry content.
     *
     * @param rawHtml source markup
     * @return parsed document with pretty printing disabled
     */
    public Document parse(String rawHtml) {
        Parser parser = Parser.htmlParser().settings(new ParseSettings(true, false));
        Document document = parser.parseInput(sanitize(rawHtml), "");
        document.outputSettings().prettyPrint(false);
        removeNonContentElements(document);
        return document;
    }

    private static void removeNonContentElements(Document document) {
        for (Element element : document.getAllElements()) {
            if (NON_CONTENT_ELEMENTS.contains(element.normalName()) && element.parent() != null) {
                element.remove();
            }
        }
        Element head = document.head();
        for (Node child : DomNodes.childNodesSnapshot(head)) {
            if (!DomNodes.isTag(child, "title")) {
                child.remove();
            }
        }
    }
}
