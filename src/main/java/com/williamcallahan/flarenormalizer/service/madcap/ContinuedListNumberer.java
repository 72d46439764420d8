package com.williamcallahan.flarenormalizer.service.madcap;

import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.HashMap;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Numbers {@code <ol madcap:continue="true">} so it picks up where the previous ordered list at
 * the same nesting depth stopped.
 */
final class ContinuedListNumberer {

    static final String CONTINUE_ATTRIBUTE = "madcap:continue";

    void number(Document document) {
        Map<Integer, Integer> nextNumberByDepth = new HashMap<>();
        for (Element list : document.select("ol")) {
            int depth = listDepth(list);
            int start;
            if ("true".equalsIgnoreCase(list.attr(CONTINUE_ATTRIBUTE).trim())) {
                start = nextNumberByDepth.getOrDefault(depth, 1);
                list.attr("start", Integer.toString(start));
            } else {
                start = DomNodes.intAttribute(list, "start", 1);
            }
            int items = 0;
            for (Element child : list.children()) {
                if (child.normalName().equals("li")) {
                    items++;
                }
            }
            nextNumberByDepth.put(depth, start + items);
        }
    }

    private static int listDepth(Element list) {
        int depth = 0;
        for (Element ancestor = list.parent(); ancestor != null; ancestor = ancestor.parent()) {
            if (DomNodes.isList(ancestor)) {
                depth++;
            }
        }
        return depth;
    }
}
