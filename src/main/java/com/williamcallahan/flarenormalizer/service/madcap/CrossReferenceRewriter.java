package com.williamcallahan.flarenormalizer.service.madcap;

import com.williamcallahan.flarenormalizer.support.AsciiTextNormalizer;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.regex.Pattern;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

/**
 * Turns {@code MadCap:xref} elements into plain anchors and points relative {@code .htm} links at
 * the converted {@code .html} files.
 */
final class CrossReferenceRewriter {

    private static final Pattern HTM_TARGET = Pattern.compile("\\.htm(#|$)");
    private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.\\-]*:");
    private static final String MADCAP_PREFIX = "madcap:";

    void rewriteXref(Element xref) {
        String href = xref.attr("href").trim();
        if (href.isEmpty()) {
            xref.replaceWith(new TextNode(DomNodes.visibleText(xref)));
            return;
        }
        String converted = convertHref(href);
        Element anchor = new Element("a");
        anchor.attr("href", converted);
        for (Attribute attribute : xref.attributes()) {
            String key = AsciiTextNormalizer.toLowerAscii(attribute.getKey());
            if (!key.equals("href") && !key.startsWith(MADCAP_PREFIX)) {
                anchor.attr(attribute.getKey(), attribute.getValue());
            }
        }
        if (DomNodes.visibleText(xref).isEmpty()) {
            anchor.text("See " + converted);
        } else {
            DomNodes.moveChildren(xref, anchor);
        }
        xref.replaceWith(anchor);
    }

    /**
     * Rewrites the target of an ordinary anchor when it is a relative {@code .htm} link.
     */
    void rewriteAnchor(Element anchor) {
        String href = anchor.attr("href").trim();
        if (href.isEmpty() || isAbsolute(href)) {
            return;
        }
        String converted = convertHref(href);
        if (!converted.equals(href)) {
            anchor.attr("href", converted);
        }
    }

    static String convertHref(String href) {
        return HTM_TARGET.matcher(href).replaceFirst(".html$1");
    }

    private static boolean isAbsolute(String href) {
        return href.startsWith("//") || URI_SCHEME.matcher(href).find();
    }
}
