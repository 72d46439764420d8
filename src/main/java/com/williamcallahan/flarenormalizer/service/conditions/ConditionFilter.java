package com.williamcallahan.flarenormalizer.service.conditions;

import com.williamcallahan.flarenormalizer.domain.ProcessingContext;
import com.williamcallahan.flarenormalizer.support.AsciiTextNormalizer;
import java.util.List;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Removes conditionally published content that should not reach the output.
 *
 * Every removed element is replaced by a comment recording its condition value, so exclusions
 * stay auditable in the normalized tree.
 */
@Service
public class ConditionFilter {

    private static final Logger log = LoggerFactory.getLogger(ConditionFilter.class);
    static final String MADCAP_CONDITIONS = "madcap:conditions";
    static final String DATA_CONDITIONS = "data-mc-conditions";
    static final String REMOVED_COMMENT_PREFIX = " Removed content with MadCap conditions: ";

    private final SkipConditionTaxonomy taxonomy;

    public ConditionFilter(SkipConditionTaxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    /**
     * Replaces excluded elements with audit comments.
     *
     * An element is excluded when one of its conditions is listed in
     * {@link ProcessingContext#excludeConditions()}, or when the skip taxonomy matches and none of
     * its conditions is listed in {@link ProcessingContext#includeConditions()}.
     *
     * @param document tree to filter in place
     * @param context processing options
     * @return number of elements removed
     */
    public int apply(Document document, ProcessingContext context) {
        int removed = 0;
        for (Element element : document.getAllElements()) {
            if (!element.hasAttr(MADCAP_CONDITIONS) && !element.hasAttr(DATA_CONDITIONS)) {
                continue;
            }
            if (element.ownerDocument() == null || element.parent() == null) {
                // inside a subtree removed earlier in this pass
                continue;
            }
            String madcapConditions = element.attr(MADCAP_CONDITIONS);
            String dataConditions = element.attr(DATA_CONDITIONS);
            if (shouldRemove(madcapConditions, dataConditions, context)) {
                String recorded = recordedConditions(madcapConditions, dataConditions);
                element.replaceWith(new Comment(REMOVED_COMMENT_PREFIX + sanitizeForComment(recorded) + " "));
                log.debug("Removed <{}> with conditions '{}'", element.tagName(), recorded);
                removed++;
            }
        }
        return removed;
    }

    private static String recordedConditions(String madcapConditions, String dataConditions) {
        if (madcapConditions.isEmpty()) {
            return dataConditions;
        }
        if (dataConditions.isEmpty()) {
            return madcapConditions;
        }
        return madcapConditions + "; " + dataConditions;
    }

    boolean shouldRemove(String madcapConditions, String dataConditions, ProcessingContext context) {
        List<String> names = SkipConditionTaxonomy.splitConditionNames(madcapConditions + ";" + dataConditions);
        for (String name : names) {
            if (context.excludeConditions().contains(AsciiTextNormalizer.foldLabel(name))) {
                return true;
            }
        }
        if (!taxonomy.matches(madcapConditions + " " + dataConditions)) {
            return false;
        }
        for (String name : names) {
            if (context.includeConditions().contains(AsciiTextNormalizer.foldLabel(name))) {
                return false;
            }
        }
        return true;
    }

    private static String sanitizeForComment(String value) {
        return value.replace("--", "- -");
    }
}
