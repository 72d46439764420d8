package com.williamcallahan.flarenormalizer.service.lists;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.flarenormalizer.config.AppProperties;
import com.williamcallahan.flarenormalizer.service.MadCapSourceParser;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;

class ListReconstructorTest {

    private final MadCapSourceParser parser = new MadCapSourceParser();
    private final ListReconstructor reconstructor = new ListReconstructor(new AppProperties());

    @Test
    void reconstruct_styledSiblingListNestsUnderPrecedingItem() {
        Document document = reconstruct("<ol><li>Step 1</li><li>Step 2</li>"
            + "<ol style=\"list-style-type: lower-alpha;\"><li>a</li><li>b</li></ol></ol>");

        Elements topLists = document.select("body > ol");
        assertEquals(1, topLists.size());
        Element outer = topLists.first();
        assertEquals(2, outer.children().size());
        assertOnlyItems(outer);

        Element stepTwo = outer.child(1);
        Element nested = stepTwo.selectFirst("ol");
        assertNotNull(nested);
        assertEquals("a b", nested.text());
        assertEquals("Step 1 Step 2 a b", document.body().text());
    }

    @Test
    void reconstruct_orphanParagraphJoinsPreviousItemUnlessItIsAnAction() {
        Document document = reconstruct("<ul><li>Open the file</li><p>It opens in a new window.</p>"
            + "<p>Click Save</p></ul>");

        Element list = document.selectFirst("ul");
        assertOnlyItems(list);
        assertEquals(2, list.children().size());
        assertEquals("Open the file It opens in a new window.", list.child(0).text());
        assertEquals("Click Save", list.child(1).text());
    }

    @Test
    void reconstruct_bareTextInsideListBecomesItem() {
        Document document = reconstruct("<ul>Install the agent<li>Restart</li></ul>");

        Element list = document.selectFirst("ul");
        assertOnlyItems(list);
        assertEquals(2, list.children().size());
        assertEquals("Install the agent", list.child(0).text());
    }

    @Test
    void reconstruct_strayItemsAreWrappedInList() {
        Document document = reconstruct("<div><li>One</li><li>Two</li></div>");

        assertEquals(2, document.select("div > ul > li").size());
        assertTrue(document.select("div > li").isEmpty());
    }

    @Test
    void reconstruct_itemsStrandedAfterListRejoinIt() {
        Document document = reconstruct("<ul><li>A</li></ul><li>B</li>");

        assertEquals(1, document.select("ul").size());
        assertEquals(2, document.select("body > ul > li").size());
        assertTrue(document.select("body > li").isEmpty());
    }

    @Test
    void reconstruct_listAfterIntroducingItemNestsUnderIt() {
        Document document = reconstruct("<ul><li>Do the following:</li></ul><ol><li>Back up</li><li>Upgrade</li></ol>");

        assertTrue(document.select("body > ol").isEmpty());
        Element item = document.selectFirst("body > ul > li");
        assertNotNull(item.selectFirst("ol"));
        assertEquals(2, item.select("ol > li").size());
    }

    @Test
    void reconstruct_subListAfterInterveningNoteNestsWithNoteInOrder() {
        Document document = reconstruct("<ol><li>Configure the following:</li></ol><p>Note: these are optional</p>"
            + "<ol style=\"list-style-type: lower-alpha\"><li>x</li><li>y</li></ol>");

        Elements topLists = document.select("body > ol");
        assertEquals(1, topLists.size());
        assertTrue(document.select("body > p").isEmpty());
        Element item = topLists.first().child(0);
        List<String> tags = new ArrayList<>();
        for (Element child : item.children()) {
            tags.add(child.normalName());
        }
        assertEquals(List.of("p", "ol"), tags);
        assertEquals("Note: these are optional", item.child(0).text());
        assertEquals("x y", item.child(1).text());
        assertEquals("Configure the following: Note: these are optional x y", document.body().text());
    }

    @Test
    void reconstruct_unrelatedListAfterParagraphStaysAtTopLevel() {
        Document document = reconstruct("<ol><li>Open the app.</li></ol><p>Then read more.</p><ul><li>a</li></ul>");

        assertEquals(1, document.select("body > ul").size());
        assertTrue(document.select("ol ul").isEmpty());
    }

    @Test
    void reconstruct_numberedParagraphsBecomeOrderedList() {
        Document document = reconstruct("<p>1. First</p><p>2. Second</p>");

        Element list = document.selectFirst("body > ol");
        assertNotNull(list);
        assertFalse(list.hasAttr("start"));
        assertEquals("First", list.child(0).text());
        assertEquals("Second", list.child(1).text());
        assertTrue(document.select("body > p").isEmpty());
    }

    @Test
    void reconstruct_numberedRunStartingLaterKeepsStart() {
        Document document = reconstruct("<p>3. Third</p><p>4. Fourth</p>");

        assertEquals("3", document.selectFirst("ol").attr("start"));
    }

    @Test
    void reconstruct_singleNumberedParagraphStaysParagraph() {
        Document document = reconstruct("<p>1. Only</p><p>Something else</p>");

        assertTrue(document.select("ol").isEmpty());
        assertEquals("1. Only", document.selectFirst("p").text());
    }

    @Test
    void reconstruct_noteAfterListMovesIntoLastItem() {
        Document document = reconstruct("<ol><li>Open the file</li></ol><p>Note: back up first.</p>"
            + "<p>The next section covers exports in considerable detail for administrators.</p>");

        Element lastItem = document.selectFirst("ol > li");
        assertEquals("Open the file Note: back up first.", lastItem.text());
        assertEquals(1, document.select("body > p").size());
    }

    @Test
    void reconstruct_stepResultSentenceAfterListJoinsLastItem() {
        Document document = reconstruct("<ol><li>Click Save</li></ol><p>The confirmation dialog is displayed.</p>"
            + "<p>Exports are covered in the next chapter.</p>");

        Element lastItem = document.selectFirst("ol > li");
        assertEquals("Click Save The confirmation dialog is displayed.", lastItem.text());
        assertEquals(1, document.select("body > p").size());
        assertEquals("Exports are covered in the next chapter.", document.selectFirst("body > p").text());
    }

    @Test
    void reconstruct_definitionListChildrenBecomeTermsAndDescriptions() {
        Document document = reconstruct("<dl><p>Term</p><p>Meaning</p>stray</dl>");

        Element list = document.selectFirst("dl");
        List<String> tags = new ArrayList<>();
        for (Element child : list.children()) {
            tags.add(child.normalName());
        }
        assertEquals(List.of("dt", "dd", "dd"), tags);
        assertEquals("stray", list.child(2).text());
    }

    @Test
    void reconstruct_marksListsAndSecondRunChangesNothing() {
        Document document = reconstruct("<ol><li>Step 1</li><li>Step 2</li>"
            + "<ol style=\"list-style-type: lower-alpha;\"><li>a</li></ol><p>Note: saved</p></ol>"
            + "<li>Stray</li><p>1. x</p><p>2. y</p>");
        for (Element list : document.select("ol, ul")) {
            assertTrue(ListReconstructor.isProcessed(list));
        }
        String first = document.body().html();

        reconstructor.reconstruct(document);

        assertEquals(first, document.body().html());
    }

    @Test
    void reconstruct_scrambledListsAlwaysEndWithOnlyItemsInsideLists() {
        Random random = new Random(20240611L);
        for (int round = 0; round < 50; round++) {
            Document document = Document.createShell("");
            List<String> tokens = new ArrayList<>();
            int[] counter = {0};
            for (int block = 0; block < 3; block++) {
                document.body().appendChild(randomList(random, 0, tokens, counter));
                if (random.nextBoolean()) {
                    document.body().appendChild(textElement("p", tokens, counter));
                }
            }

            reconstructor.reconstruct(document);

            for (Element list : document.select("ol, ul")) {
                assertOnlyItems(list);
            }
            List<String> remaining = new ArrayList<>(Arrays.asList(document.body().text().split("\\s+")));
            Collections.sort(remaining);
            Collections.sort(tokens);
            assertEquals(tokens, remaining, "round " + round);
        }
    }

    private Element randomList(Random random, int depth, List<String> tokens, int[] counter) {
        Element list = new Element(random.nextBoolean() ? "ol" : "ul");
        int children = 1 + random.nextInt(4);
        for (int i = 0; i < children; i++) {
            int kind = random.nextInt(depth < 2 ? 5 : 3);
            switch (kind) {
                case 0:
                case 1:
                    list.appendChild(textElement("li", tokens, counter));
                    break;
                case 2:
                    if (random.nextBoolean()) {
                        list.appendChild(textElement("p", tokens, counter));
                    } else {
                        list.appendChild(new TextNode(" " + token(tokens, counter) + " "));
                    }
                    break;
                default:
                    list.appendChild(randomList(random, depth + 1, tokens, counter));
                    break;
            }
        }
        return list;
    }

    private static Element textElement(String tag, List<String> tokens, int[] counter) {
        Element element = new Element(tag);
        element.appendText(token(tokens, counter));
        return element;
    }

    private static String token(List<String> tokens, int[] counter) {
        String token = "item" + counter[0]++;
        tokens.add(token);
        return token;
    }

    private static void assertOnlyItems(Element list) {
        for (Node child : list.childNodes()) {
            if (child instanceof Element element) {
                assertEquals("li", element.normalName(), "unexpected <" + element.normalName() + "> in list");
            } else if (child instanceof TextNode text) {
                assertTrue(text.isBlank(), "bare text '" + text.text() + "' in list");
            }
        }
    }

    private Document reconstruct(String bodyHtml) {
        Document document = parser.parse("<html><body>" + bodyHtml + "</body></html>");
        reconstructor.reconstruct(document);
        return document;
    }
}
