package com.williamcallahan.flarenormalizer.service.lists;

import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Converts runs of sibling paragraphs numbered "1. ", "2. ", ... into an ordered list.
 */
class NumberedParagraphLists {

    private static final Pattern NUMBERED = Pattern.compile("^(\\d+)\\.\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*\\d+\\.\\s+");
    private static final int MIN_RUN = 2;

    int convert(Document document) {
        int converted = 0;
        for (Element parent : new ArrayList<>(document.getAllElements())) {
            if (parent.parent() == null) {
                continue;
            }
            converted += convertChildren(parent);
        }
        return converted;
    }

    private int convertChildren(Element parent) {
        int converted = 0;
        List<Element> run = new ArrayList<>();
        int expected = -1;
        for (Element child : new ArrayList<>(parent.children())) {
            Integer number = numberOf(child);
            boolean adjacent = !run.isEmpty() && run.get(run.size() - 1).nextElementSibling() == child;
            if (number != null && adjacent && number == expected) {
                run.add(child);
                expected++;
                continue;
            }
            converted += flush(run);
            run = new ArrayList<>();
            if (number != null) {
                run.add(child);
                expected = number + 1;
            }
        }
        converted += flush(run);
        return converted;
    }

    private static Integer numberOf(Element element) {
        if (!element.normalName().equals("p")) {
            return null;
        }
        Matcher matcher = NUMBERED.matcher(DomNodes.visibleText(element));
        if (!matcher.matches()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException overflow) {
            return null;
        }
    }

    private static int flush(List<Element> run) {
        if (run.size() < MIN_RUN) {
            return 0;
        }
        Element first = run.get(0);
        Element list = new Element("ol");
        int start = numberOf(first);
        if (start != 1) {
            list.attr("start", Integer.toString(start));
        }
        first.before(list);
        for (Element paragraph : run) {
            Element item = list.appendElement("li");
            stripLeadingNumber(paragraph);
            DomNodes.moveChildren(paragraph, item);
            paragraph.remove();
        }
        return 1;
    }

    private static void stripLeadingNumber(Element paragraph) {
        for (Node child : paragraph.childNodes()) {
            if (child instanceof TextNode textNode) {
                if (!DomNodes.hasVisibleText(textNode)) {
                    continue;
                }
                Matcher matcher = LEADING_NUMBER.matcher(textNode.getWholeText());
                if (matcher.find()) {
                    textNode.text(textNode.getWholeText().substring(matcher.end()));
                    return;
                }
            }
            break;
        }
        // number split across inline markup: fall back to the plain text
        Matcher numbered = NUMBERED.matcher(DomNodes.visibleText(paragraph));
        if (numbered.matches()) {
            paragraph.text(numbered.group(2));
        }
    }
}
