package com.williamcallahan.flarenormalizer.service.lists;

import com.williamcallahan.flarenormalizer.support.AsciiTextNormalizer;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;

/**
 * Tells new procedure steps apart from text that continues the previous step.
 *
 * The pattern tables are ordered and data-driven so the classification can be inspected and
 * tested on its own.
 */
public class ContinuationClassifier {

    private static final List<Pattern> ACTION_PATTERNS = compile(
        "^(click|select|choose|press|open|close|enter|type|fill)",
        "^(go to|navigate to|switch to)",
        "^(add|delete|remove|create|edit|modify)",
        "^(save|submit|cancel|confirm)",
        "^(enable|disable|activate|deactivate)",
        "^(drag|drop|move|copy|paste)",
        "^(upload|download|import|export)",
        "^(login|logout|sign in|sign out)",
        "^(review|check|verify|validate)");

    private static final List<Pattern> EXPLANATORY_PATTERNS = compile(
        "^the .+ (is|are) displayed",
        "^a .+ (is|are) (displayed|shown)",
        "^this (opens|displays|shows)",
        "^the following",
        "^you (can|will|should) now",
        "^the system (will|displays)",
        "^a (dialog|window|panel|popup|prompt) (is|appears)",
        "^the (dialog|window|panel|popup|prompt) (is|appears)",
        "^the activity's .+ (is|are) displayed",
        "^a security .+ (is|are) displayed");

    private static final List<Pattern> CONTINUATION_INDICATORS = compile(
        "^(Note|Tip|Warning|Caution|Important):",
        "^(For example|Example:|e\\.g\\.|i\\.e\\.)",
        "^(Additionally|Furthermore|Moreover|Also)",
        "^(See also|Refer to|Reference)",
        "^\\s*\\+",
        "^(Step \\d+|Phase \\d+|Part \\d+)");

    private static final List<String> CONTINUATION_CLASS_FRAGMENTS = List.of("note", "continuation", "example", "callout");
    private static final List<String> INDENT_STYLE_FRAGMENTS = List.of("margin-left", "padding-left", "text-indent");
    private static final Pattern NUMBERED_START = Pattern.compile("^\\d+\\.\\s");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]$");

    private final int shortFragmentLength;

    public ContinuationClassifier(int shortFragmentLength) {
        this.shortFragmentLength = shortFragmentLength;
    }

    /**
     * @return true when the text starts with an imperative step verb
     */
    public boolean looksLikeActionItem(String text) {
        return anyMatches(ACTION_PATTERNS, text.trim());
    }

    /**
     * @return true when the text describes the result of the previous step
     */
    public boolean isExplanatoryText(String text) {
        return anyMatches(EXPLANATORY_PATTERNS, text.trim());
    }

    /**
     * Decides whether a paragraph directly after a list belongs to the list's last item.
     *
     * @param element the paragraph
     * @param text its trimmed visible text
     * @return true for admonitions, examples, step results, indented blocks and short
     *     unpunctuated fragments
     */
    public boolean isContinuationContent(Element element, String text) {
        if (NUMBERED_START.matcher(text).find()) {
            return false;
        }
        if (anyMatches(CONTINUATION_INDICATORS, text) || isExplanatoryText(text)) {
            return true;
        }
        String className = element.className();
        for (String fragment : CONTINUATION_CLASS_FRAGMENTS) {
            if (className.contains(fragment)) {
                return true;
            }
        }
        String style = AsciiTextNormalizer.toLowerAscii(element.attr("style"));
        for (String fragment : INDENT_STYLE_FRAGMENTS) {
            if (style.contains(fragment)) {
                return true;
            }
        }
        return !text.isEmpty() && text.length() < shortFragmentLength && !SENTENCE_END.matcher(text).find();
    }

    private static boolean anyMatches(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();
    }
}
