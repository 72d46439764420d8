package com.williamcallahan.flarenormalizer.service.madcap;

import com.williamcallahan.flarenormalizer.domain.ProcessingWarning.WarningType;
import com.williamcallahan.flarenormalizer.service.NormalizationRun;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import org.jsoup.nodes.Element;

/**
 * Rewrites {@code MadCap:dropDown} into a titled collapsible container.
 *
 * Output shape: {@code <div class="madcap-dropdown collapsible-block" data-title="...">body</div>}.
 */
final class DropdownRewriter {

    static final String CONTAINER_CLASSES = "madcap-dropdown collapsible-block";
    static final String DEFAULT_TITLE = "More Information";

    void rewrite(Element dropDown, NormalizationRun run) {
        Element head = childTagContaining(dropDown, "dropdownhead");
        Element hotspot = head == null
            ? childTagContaining(dropDown, "dropdownhotspot")
            : childTagContaining(head, "dropdownhotspot");
        Element body = childTagContaining(dropDown, "dropdownbody");

        String title = hotspot != null ? DomNodes.visibleText(hotspot)
            : head != null ? DomNodes.visibleText(head) : "";
        if (title.isEmpty()) {
            title = DEFAULT_TITLE;
        }
        if (head == null && hotspot == null) {
            run.warn(WarningType.MALFORMED_MADCAP_ELEMENT, "Dropdown without head, using default title", dropDown.tagName());
        }

        Element container = new Element("div");
        container.attr("class", CONTAINER_CLASSES);
        container.attr("data-title", title);
        if (body != null) {
            DomNodes.moveChildren(body, container);
        } else {
            run.warn(WarningType.MALFORMED_MADCAP_ELEMENT, "Dropdown without body, keeping remaining content", title);
            if (head != null) {
                head.remove();
            } else if (hotspot != null) {
                hotspot.remove();
            }
            DomNodes.moveChildren(dropDown, container);
        }
        dropDown.replaceWith(container);
    }

    private static Element childTagContaining(Element parent, String fragment) {
        for (Element child : parent.children()) {
            if (child.normalName().contains(fragment)) {
                return child;
            }
        }
        return null;
    }
}
