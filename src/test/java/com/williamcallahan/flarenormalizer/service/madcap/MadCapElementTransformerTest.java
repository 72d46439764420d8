package com.williamcallahan.flarenormalizer.service.madcap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.flarenormalizer.config.AppProperties;
import com.williamcallahan.flarenormalizer.domain.ExtractedVariable;
import com.williamcallahan.flarenormalizer.domain.ProcessingContext;
import com.williamcallahan.flarenormalizer.domain.ProcessingWarning.WarningType;
import com.williamcallahan.flarenormalizer.domain.VariableSet;
import com.williamcallahan.flarenormalizer.service.MadCapSourceParser;
import com.williamcallahan.flarenormalizer.service.NormalizationRun;
import com.williamcallahan.flarenormalizer.service.io.FileOperationsService;
import com.williamcallahan.flarenormalizer.service.snippets.SnippetResolver;
import com.williamcallahan.flarenormalizer.service.variables.ProjectVariables;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

class MadCapElementTransformerTest {

    private final MadCapSourceParser parser = new MadCapSourceParser();
    private final MadCapElementTransformer transformer = transformer();
    private final ProjectVariables variables = new ProjectVariables(List.of(
        new VariableSet("General", Path.of("General.flvar"), Map.of("ProductName", "Acme", "Version", "4.2"))
    ), List.of());

    @Test
    void transform_dropdownBecomesTitledContainer() {
        Document document = transform(
            "<MadCap:dropDown><MadCap:dropDownHead><MadCap:dropDownHotspot>More details</MadCap:dropDownHotspot>"
                + "</MadCap:dropDownHead><MadCap:dropDownBody><p>Body text</p></MadCap:dropDownBody></MadCap:dropDown>",
            ProcessingContext.defaults());

        Element container = document.body().child(0);
        assertEquals("div", container.tagName());
        assertTrue(container.hasClass("madcap-dropdown"));
        assertEquals("More details", container.attr("data-title"));
        assertEquals("<p>Body text</p>", container.html());
    }

    @Test
    void transform_dropdownWithoutHeadUsesDefaultTitle() {
        NormalizationRun run = run(ProcessingContext.defaults());
        Document document = parser.parse("<MadCap:dropDown><MadCap:dropDownBody><p>Only body</p></MadCap:dropDownBody></MadCap:dropDown>");

        transformer.transform(document, run, (body, path, nested) -> List.of());

        assertEquals("More Information", document.body().child(0).attr("data-title"));
        assertEquals(WarningType.MALFORMED_MADCAP_ELEMENT, run.warnings().get(0).type());
    }

    @Test
    void transform_xrefBecomesAnchorWithHtmlTarget() {
        Document document = transform(
            "<p><MadCap:xref href=\"Setup/Install.htm#prereq\" class=\"link\" madcap:targetname=\"x\">Install</MadCap:xref></p>"
                + "<p><MadCap:xref href=\"Other.htm\" /></p>",
            ProcessingContext.defaults());

        Element first = document.select("a").get(0);
        assertEquals("Setup/Install.html#prereq", first.attr("href"));
        assertEquals("link", first.attr("class"));
        assertFalse(first.hasAttr("madcap:targetname"));
        assertEquals("Install", first.text());
        Element second = document.select("a").get(1);
        assertEquals("See Other.html", second.text());
    }

    @Test
    void transform_relativeAnchorsAreRewrittenButExternalOnesAreNot() {
        Document document = transform(
            "<a href=\"Topic.htm\">a</a><a href=\"https://example.com/page.htm\">b</a>", ProcessingContext.defaults());

        assertEquals("Topic.html", document.select("a").get(0).attr("href"));
        assertEquals("https://example.com/page.htm", document.select("a").get(1).attr("href"));
    }

    @Test
    void transform_variableModes() {
        String html = "<p><MadCap:variable name=\"General.ProductName\" /> v<span data-mc-variable=\"General.Version\"></span></p>";

        assertEquals("<p>Acme v4.2</p>", transform(html, ProcessingContext.defaults()).body().html());

        NormalizationRun extractRun = run(ProcessingContext.defaults().withExtractVariables(true));
        Document extracted = parser.parse(html);
        transformer.transform(extracted, extractRun, (body, path, nested) -> List.of());
        assertEquals("<p>{general-product-name} v{general-version}</p>", extracted.body().html());
        assertEquals(List.of(new ExtractedVariable("General.ProductName", "Acme"),
            new ExtractedVariable("General.Version", "4.2")), extractRun.extractedVariables());

        Document preserved = transform(html, ProcessingContext.defaults().withPreserveVariables(true));
        assertNotNull(preserved.selectFirst("madcap|variable"));
        assertNotNull(preserved.selectFirst("span[data-mc-variable]"));
    }

    @Test
    void transform_keepsTextAlreadyResolvedAtExport() {
        Document document = transform("<p><MadCap:variable name=\"General.ProductName\">Acme Cloud</MadCap:variable></p>",
            ProcessingContext.defaults());

        assertEquals("<p>Acme Cloud</p>", document.body().html());
    }

    @Test
    void transform_detectsVariableFromClassName() {
        Document document = transform("<p><span class=\"mc-variable General.ProductName\"></span></p>",
            ProcessingContext.defaults());

        assertEquals("<p>Acme</p>", document.body().html());
    }

    @Test
    void transform_variableWithoutNameBecomesMarkedPlaceholder() {
        NormalizationRun run = run(ProcessingContext.defaults());
        Document document = parser.parse("<p><MadCap:variable /></p>");

        transformer.transform(document, run, (body, path, nested) -> List.of());

        assertTrue(document.body().text().startsWith("{Variable: "));
        assertEquals(WarningType.MALFORMED_MADCAP_ELEMENT, run.warnings().get(0).type());
    }

    @Test
    void transform_continuedListStartsAfterPreviousList() {
        Document document = transform(
            "<ol><li>a</li><li>b</li></ol><p>Interlude</p><ol madcap:continue=\"true\"><li>c</li></ol>"
                + "<ol><li>fresh</li></ol><ol madcap:continue=\"true\"><li>d</li></ol>",
            ProcessingContext.defaults());

        List<Element> lists = document.select("ol");
        assertEquals("3", lists.get(1).attr("start"));
        assertFalse(lists.get(1).hasAttr("madcap:continue"));
        assertEquals("", lists.get(2).attr("start"));
        assertEquals("2", lists.get(3).attr("start"));
    }

    @Test
    void transform_retagsSemanticClasses() {
        Document document = transform(
            "<p class=\"mc-note\" id=\"n1\">Note text</p><div class=\"mc-warning\">Careful</div>"
                + "<p class=\"mc-heading-3\">Heading</p><div class=\"mc-procedure\"><li>Step</li></div>"
                + "<li class=\"note\">Item stays</li>",
            ProcessingContext.defaults());

        Element note = document.selectFirst("blockquote.note");
        assertNotNull(note);
        assertEquals("n1", note.id());
        assertNotNull(document.selectFirst("blockquote.warning"));
        assertEquals("Heading", document.selectFirst("h3").text());
        assertNotNull(document.selectFirst("ol > li"));
        assertNotNull(document.selectFirst("li.note"));
    }

    @Test
    void transform_removesBookkeepingAttributes() {
        Document document = transform(
            "<p madcap:conditions=\"Online\" madcap:param_level=\"2\" madcap:exclude=\"true\" class=\"keep\">x</p>",
            ProcessingContext.defaults());

        Element paragraph = document.selectFirst("p");
        assertEquals(1, paragraph.attributes().size());
        assertEquals("keep", paragraph.className());
        assertNull(document.selectFirst("[madcap:conditions]"));
    }

    private Document transform(String html, ProcessingContext context) {
        Document document = parser.parse(html);
        transformer.transform(document, run(context), (body, path, nested) -> List.of());
        return document;
    }

    private NormalizationRun run(ProcessingContext context) {
        return new NormalizationRun(context, null, null, variables);
    }

    private static MadCapElementTransformer transformer() {
        AppProperties appProperties = new AppProperties();
        return new MadCapElementTransformer(new SnippetResolver(new FileOperationsService(appProperties), appProperties));
    }
}
