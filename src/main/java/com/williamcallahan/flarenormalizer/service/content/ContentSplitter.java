package com.williamcallahan.flarenormalizer.service.content;

import com.williamcallahan.flarenormalizer.service.lists.ListReconstructor;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Splits paragraphs that mix text with block images.
 *
 * Each resulting sibling holds text with inline content, a single block image, or a single
 * bullet item promoted from a {@code "* text"} run. Paragraphs whose images are all inline icons
 * are left whole.
 */
@Service
public class ContentSplitter {

    private static final Logger log = LoggerFactory.getLogger(ContentSplitter.class);
    private static final Pattern BULLET_RUN = Pattern.compile("^(\\s*\\*\\s+)(.*)", Pattern.DOTALL);

    private final ImageClassifier imageClassifier;

    public ContentSplitter(ImageClassifier imageClassifier) {
        this.imageClassifier = imageClassifier;
    }

    /**
     * Splits mixed paragraphs in place.
     *
     * @param document tree to rewrite
     * @return number of paragraphs split
     */
    public int split(Document document) {
        int split = 0;
        for (Element paragraph : new ArrayList<>(document.getElementsByTag("p"))) {
            if (paragraph.parent() == null || !needsSplit(paragraph)) {
                continue;
            }
            splitParagraph(paragraph);
            split++;
        }
        if (split > 0) {
            log.debug("Split {} mixed-content paragraph(s)", split);
        }
        return split;
    }

    private boolean needsSplit(Element paragraph) {
        List<Element> images = paragraph.getElementsByTag("img");
        if (images.isEmpty()) {
            return false;
        }
        boolean hasText = false;
        for (Node child : paragraph.childNodes()) {
            if (child instanceof TextNode textNode && DomNodes.hasVisibleText(textNode)) {
                hasText = true;
                break;
            }
        }
        return hasText && images.stream().anyMatch(imageClassifier::isBlockImage);
    }

    private void splitParagraph(Element paragraph) {
        List<Element> pieces = new ArrayList<>();
        Element current = null;
        for (Node child : DomNodes.childNodesSnapshot(paragraph)) {
            if (child instanceof TextNode textNode) {
                if (!DomNodes.hasVisibleText(textNode)) {
                    if (current != null) {
                        current.appendChild(child);
                    }
                    continue;
                }
                Matcher bullet = BULLET_RUN.matcher(textNode.getWholeText().trim());
                if (bullet.matches() && current != null && current.childNodeSize() > 0) {
                    Element list = new Element("ul");
                    list.attr(ListReconstructor.PROCESSED_ATTRIBUTE, "true");
                    list.appendElement("li").text(bullet.group(2).trim());
                    pieces.add(list);
                    current = null;
                    continue;
                }
                current = ensureParagraph(current, pieces);
                current.appendChild(child);
            } else if (DomNodes.isTag(child, "img") && imageClassifier.isBlockImage((Element) child)) {
                Element imageParagraph = new Element("p");
                imageParagraph.appendChild(child);
                pieces.add(imageParagraph);
                current = null;
            } else {
                current = ensureParagraph(current, pieces);
                current.appendChild(child);
            }
        }
        if (paragraph.hasAttr("id") && !pieces.isEmpty()) {
            pieces.get(0).attr("id", paragraph.attr("id"));
        }
        for (Element piece : pieces) {
            paragraph.before(piece);
        }
        paragraph.remove();
    }

    private static Element ensureParagraph(Element current, List<Element> pieces) {
        if (current != null) {
            return current;
        }
        Element paragraph = new Element("p");
        pieces.add(paragraph);
        return paragraph;
    }
}
