package com.williamcallahan.flarenormalizer.service.conditions;

import com.williamcallahan.flarenormalizer.domain.ConditionAnalysis;
import com.williamcallahan.flarenormalizer.domain.ConditionInfo;
import com.williamcallahan.flarenormalizer.domain.ConditionInfo.ConditionCategory;
import com.williamcallahan.flarenormalizer.support.AsciiTextNormalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Discovers which conditions a set of source files uses, for presenting include/exclude choices.
 */
@Service
public class ConditionAnalyzer {

    private static final Pattern HTML_EXTENSION = Pattern.compile(".*\\.(htm|html)$");

    private static final Pattern STATUS = Pattern.compile(
            "\\b(deprecated?|deprecation|obsolete|legacy|old|paused?|halted?|stopped?|discontinued?|retired?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COLOR = Pattern.compile(
            "\\b(black|red|gray|grey|blue|green|yellow|orange|purple|pink)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRINT = Pattern.compile(
            "\\b(print[\\s\\-_]?only|printonly|online[\\s\\-_]?only|onlineonly)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEVELOPMENT = Pattern.compile(
            "\\b(cancelled?|canceled?|abandoned|shelved|draft|beta|alpha|experimental)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern VISIBILITY = Pattern.compile(
            "\\b(hidden|internal|private|public|external)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> DEPRECATED_PATTERNS = List.of(
            Pattern.compile("\\b(deprecated?|deprecation|obsolete|legacy|old)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(cancelled?|canceled?|abandoned|shelved)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(discontinued?|retired?|paused?|halted?|stopped?)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(black|red|gray|grey)\\b", Pattern.CASE_INSENSITIVE));

    /**
     * Analyzes file contents keyed by path.
     *
     * @param files path to content; entries that are not HTML are ignored
     * @return conditions sorted by name with usage counted per file
     */
    public ConditionAnalysis analyze(Map<String, String> files) {
        Map<String, Integer> usage = new TreeMap<>();
        Map<String, Set<String>> filesByCondition = new TreeMap<>();
        int analyzed = 0;

        for (Map.Entry<String, String> file : files.entrySet()) {
            String path = file.getKey();
            String content = file.getValue() == null ? "" : file.getValue();
            if (!isHtmlFile(path, content)) {
                continue;
            }
            analyzed++;
            for (String condition : extractConditions(content)) {
                usage.merge(condition, 1, Integer::sum);
                filesByCondition.computeIfAbsent(condition, key -> new TreeSet<>()).add(path);
            }
        }

        List<String> conditions = new ArrayList<>(usage.keySet());
        Map<String, List<String>> fileLists = new TreeMap<>();
        List<ConditionInfo> details = new ArrayList<>();
        for (String condition : conditions) {
            fileLists.put(condition, List.copyOf(filesByCondition.get(condition)));
            details.add(describe(condition, usage.get(condition)));
        }
        return new ConditionAnalysis(conditions, analyzed, usage, fileLists, details);
    }

    /**
     * Classifies one condition.
     *
     * @param condition condition name
     * @param usage number of files using it
     * @return category, deprecation flag and description
     */
    public ConditionInfo describe(String condition, int usage) {
        ConditionCategory category = categorize(condition);
        boolean deprecated = DEPRECATED_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(condition).find());
        return new ConditionInfo(condition, category, deprecated, usage, describe(condition, category));
    }

    ConditionCategory categorize(String condition) {
        if (STATUS.matcher(condition).find()) {
            return ConditionCategory.STATUS;
        }
        if (COLOR.matcher(condition).find()) {
            return ConditionCategory.COLOR;
        }
        if (PRINT.matcher(condition).find()) {
            return ConditionCategory.PRINT;
        }
        if (DEVELOPMENT.matcher(condition).find()) {
            return ConditionCategory.DEVELOPMENT;
        }
        if (VISIBILITY.matcher(condition).find()) {
            return ConditionCategory.VISIBILITY;
        }
        return ConditionCategory.CUSTOM;
    }

    private static String describe(String condition, ConditionCategory category) {
        String lower = AsciiTextNormalizer.toLowerAscii(condition);
        switch (category) {
            case STATUS:
                if (lower.contains("deprecated")) {
                    return "Deprecated content - usually excluded from output";
                }
                if (lower.contains("obsolete")) {
                    return "Obsolete content - no longer relevant";
                }
                if (lower.contains("legacy")) {
                    return "Legacy content - from previous versions";
                }
                break;
            case COLOR:
                return "Color-based condition - often used for review status or content categorization";
            case PRINT:
                if (lower.contains("print")) {
                    return "Print-only content - not shown in online output";
                }
                if (lower.contains("online")) {
                    return "Online-only content - not shown in print output";
                }
                break;
            case DEVELOPMENT:
                if (lower.contains("draft")) {
                    return "Draft content - work in progress";
                }
                if (lower.contains("beta")) {
                    return "Beta content - experimental features";
                }
                break;
            case VISIBILITY:
                if (lower.contains("internal")) {
                    return "Internal content - for internal use only";
                }
                if (lower.contains("hidden")) {
                    return "Hidden content - not visible to end users";
                }
                break;
            default:
                break;
        }
        return "Custom condition: " + condition;
    }

    private static Set<String> extractConditions(String content) {
        Set<String> conditions = new LinkedHashSet<>();
        Document document = Jsoup.parse(content);
        for (Element element : document.getAllElements()) {
            if (!element.hasAttr(ConditionFilter.MADCAP_CONDITIONS) && !element.hasAttr(ConditionFilter.DATA_CONDITIONS)) {
                continue;
            }
            String all = element.attr(ConditionFilter.MADCAP_CONDITIONS) + ";" + element.attr(ConditionFilter.DATA_CONDITIONS);
            conditions.addAll(SkipConditionTaxonomy.splitConditionNames(all));
        }
        return conditions;
    }

    private static boolean isHtmlFile(String path, String content) {
        if (path != null && HTML_EXTENSION.matcher(path.toLowerCase(Locale.ROOT)).matches()) {
            return true;
        }
        return content.contains("<html") || content.contains("<!DOCTYPE") || content.contains("<body");
    }
}
