package com.williamcallahan.flarenormalizer.service.conditions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.flarenormalizer.domain.ProcessingContext;
import com.williamcallahan.flarenormalizer.service.MadCapSourceParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.select.NodeTraversor;
import org.junit.jupiter.api.Test;

class ConditionFilterTest {

    private final ConditionFilter filter = new ConditionFilter(new SkipConditionTaxonomy());
    private final MadCapSourceParser parser = new MadCapSourceParser();

    @Test
    void apply_replacesMatchingElementWithComment() {
        Document document = parser.parse("<div data-mc-conditions=\"Deprecated\">X</div><p>Y</p>");

        int removed = filter.apply(document, ProcessingContext.defaults());

        assertEquals(1, removed);
        assertFalse(document.body().text().contains("X"));
        List<Comment> comments = comments(document);
        assertEquals(1, comments.size());
        assertTrue(comments.get(0).getData().contains("Deprecated"));
    }

    @Test
    void apply_commentRecordsBothConditionAttributes() {
        Document document = parser.parse("<div madcap:conditions=\"Online\" data-mc-conditions=\"Deprecated\">X</div>");

        assertEquals(1, filter.apply(document, ProcessingContext.defaults()));

        assertFalse(document.body().text().contains("X"));
        List<Comment> comments = comments(document);
        assertEquals(1, comments.size());
        assertTrue(comments.get(0).getData().contains("Online; Deprecated"), comments.get(0).getData());
    }

    @Test
    void apply_everyRemovalLeavesItsConditionBehind() {
        String[] conditions = {"Black", "Obsolete", "Halted", "PrintOnly", "Cancelled", "Private", "General.Draft"};
        StringBuilder html = new StringBuilder();
        for (String condition : conditions) {
            html.append("<p madcap:conditions=\"").append(condition).append("\">gone</p>");
        }
        Document document = parser.parse(html.toString());

        int removed = filter.apply(document, ProcessingContext.defaults());

        assertEquals(conditions.length, removed);
        assertEquals("", document.body().text());
        List<Comment> comments = comments(document);
        for (int i = 0; i < conditions.length; i++) {
            assertTrue(comments.get(i).getData().contains(conditions[i]), "missing audit comment for " + conditions[i]);
        }
    }

    @Test
    void apply_removesNestedExcludedContentOnce() {
        Document document = parser.parse(
            "<div madcap:conditions=\"Internal\"><p data-mc-conditions=\"Draft\">inner</p></div>");

        assertEquals(1, filter.apply(document, ProcessingContext.defaults()));
        assertEquals(1, comments(document).size());
    }

    @Test
    void apply_keepsOrdinaryConditions() {
        Document document = parser.parse("<p madcap:conditions=\"Default.Online\">kept</p>");

        assertEquals(0, filter.apply(document, ProcessingContext.defaults()));
        assertNotNull(document.selectFirst("p"));
    }

    @Test
    void apply_honorsExplicitIncludeAndExclude() {
        Document document = parser.parse(
            "<p madcap:conditions=\"Internal\">included</p><p madcap:conditions=\"Online\">excluded</p>");
        ProcessingContext context = ProcessingContext.defaults().withConditions(Set.of("online"), Set.of("INTERNAL"));

        assertEquals(1, filter.apply(document, context));
        assertEquals("included", document.body().text());
    }

    @Test
    void apply_sanitizesCommentTerminators() {
        Document document = parser.parse("<p madcap:conditions=\"Draft--x\">gone</p>");

        filter.apply(document, ProcessingContext.defaults());

        assertFalse(comments(document).get(0).getData().contains("--"));
    }

    private static List<Comment> comments(Document document) {
        List<Comment> comments = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Comment comment) {
                comments.add(comment);
            }
        }, document);
        return comments;
    }
}
