package com.williamcallahan.flarenormalizer.service.finalize;

import com.williamcallahan.flarenormalizer.support.AsciiTextNormalizer;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Brings element markup into a form that serializes as well-formed XHTML.
 */
final class XhtmlComplianceFixer {

    private static final Set<String> BOOLEAN_ATTRIBUTES = Set.of(
        "checked", "disabled", "readonly", "selected", "multiple"
    );

    private XhtmlComplianceFixer() {
    }

    static void apply(Document document) {
        for (Element element : document.body().getAllElements()) {
            lowerCaseAttributeNames(element);
            if (DomNodes.isVoid(element)) {
                element.empty();
            }
            if (DomNodes.isTag(element, "img") && !element.hasAttr("alt")) {
                element.attr("alt", element.hasAttr("title") ? element.attr("title") : "");
            }
            for (String name : BOOLEAN_ATTRIBUTES) {
                if (element.hasAttr(name)) {
                    element.attr(name, name);
                }
            }
        }
    }

    private static void lowerCaseAttributeNames(Element element) {
        List<Attribute> mixedCase = new ArrayList<>();
        for (Attribute attribute : element.attributes()) {
            if (AsciiTextNormalizer.hasAsciiUppercase(attribute.getKey())) {
                mixedCase.add(attribute);
            }
        }
        for (Attribute attribute : mixedCase) {
            element.removeAttr(attribute.getKey());
            element.attr(AsciiTextNormalizer.toLowerAscii(attribute.getKey()), attribute.getValue());
        }
    }
}
