package com.williamcallahan.flarenormalizer.service.madcap;

import com.williamcallahan.flarenormalizer.domain.ProcessingContext;
import com.williamcallahan.flarenormalizer.domain.ProcessingWarning.WarningType;
import com.williamcallahan.flarenormalizer.service.NormalizationRun;
import com.williamcallahan.flarenormalizer.service.variables.VariableNameFormatter;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces MadCap variable markers with text.
 *
 * <ul>
 *   <li>resolve mode: the variable's value, or {@code {Name}} when no set defines it</li>
 *   <li>extract mode: an attribute reference {@code {kebab-name}}, recording the value</li>
 *   <li>preserve mode: the element is left untouched</li>
 * </ul>
 * Text MadCap already resolved at export time (non-empty, dot-free, not a placeholder) is kept
 * as is in every mode except preserve.
 */
final class VariableRewriter {

    private static final Logger log = LoggerFactory.getLogger(VariableRewriter.class);
    private static final Pattern CLASS_DOT_NAME = Pattern.compile("mc-variable\\.(\\w+)");
    private static final Pattern CLASS_QUALIFIED_NAME = Pattern.compile("mc-variable\\s+([^.\\s]+)\\.([^.\\s]+)");
    private static final Pattern PLACEHOLDER_TEXT = Pattern.compile("^\\{.*}$");
    private static final int PLACEHOLDER_MARKUP_LENGTH = 50;

    static boolean isVariable(Element element) {
        return element.normalName().equals("madcap:variable")
            || element.hasAttr("data-mc-variable")
            || element.className().contains("mc-variable") && !variableName(element).isEmpty();
    }

    void rewrite(Element element, NormalizationRun run) {
        ProcessingContext context = run.context();
        if (context.preserveVariables()) {
            return;
        }
        String name = variableName(element);
        String existingText = DomNodes.visibleText(element);
        if (!existingText.isEmpty() && existingText.indexOf('.') < 0 && !PLACEHOLDER_TEXT.matcher(existingText).matches()) {
            element.replaceWith(new TextNode(existingText));
            return;
        }
        if (name.isEmpty()) {
            String markup = element.outerHtml();
            String excerpt = markup.length() > PLACEHOLDER_MARKUP_LENGTH ? markup.substring(0, PLACEHOLDER_MARKUP_LENGTH) : markup;
            run.warn(WarningType.MALFORMED_MADCAP_ELEMENT, "Variable element without a name", excerpt);
            element.replaceWith(new TextNode("{Variable: " + excerpt + "...}"));
            return;
        }

        Optional<String> value = run.variables().resolve(name);
        if (value.isEmpty()) {
            log.warn("Unresolved variable {}", name);
            run.warn(WarningType.UNRESOLVED_VARIABLE, "No variable set defines " + name, name);
        }
        if (context.extractVariables()) {
            value.ifPresent(resolved -> run.recordVariable(name, resolved));
            element.replaceWith(new TextNode("{" + VariableNameFormatter.toAttributeName(name) + "}"));
        } else {
            element.replaceWith(new TextNode(value.orElse("{" + name + "}")));
        }
    }

    static String variableName(Element element) {
        String name = element.attr("name").trim();
        if (!name.isEmpty()) {
            return name;
        }
        name = element.attr("data-mc-variable").trim();
        if (!name.isEmpty()) {
            return name;
        }
        return className(element).orElse("");
    }

    private static Optional<String> className(Element element) {
        String classes = element.className();
        Matcher dotted = CLASS_DOT_NAME.matcher(classes);
        if (dotted.find()) {
            return Optional.of(dotted.group(1));
        }
        Matcher qualified = CLASS_QUALIFIED_NAME.matcher(classes);
        if (qualified.find()) {
            return Optional.of(qualified.group(1) + "." + qualified.group(2));
        }
        return Optional.empty();
    }
}
