package com.williamcallahan.flarenormalizer.service.lists;

import com.williamcallahan.flarenormalizer.config.AppProperties;
import com.williamcallahan.flarenormalizer.config.ListHeuristicsConfig;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Repairs the list structure of MadCap exports.
 *
 * Runs, in order: numbered paragraphs to lists, sibling sub-list absorption, continuation
 * paragraphs after lists, orphan repair inside lists, stray item wrapping and definition list
 * repair. Every list is then marked with {@value #PROCESSED_ATTRIBUTE}; marked lists are left
 * alone by later runs, which keeps the pass idempotent.
 */
@Service
public class ListReconstructor {

    private static final Logger log = LoggerFactory.getLogger(ListReconstructor.class);
    public static final String PROCESSED_ATTRIBUTE = "data-list-processed";

    private final NumberedParagraphLists numberedParagraphs = new NumberedParagraphLists();
    private final SiblingListAbsorber siblingAbsorber;
    private final OrphanContentRepairer orphanRepairer;
    private final DefinitionListRepairer definitionListRepairer = new DefinitionListRepairer();

    public ListReconstructor(AppProperties appProperties) {
        ListHeuristicsConfig config = appProperties.getNormalizer().getLists();
        this.siblingAbsorber = new SiblingListAbsorber(new ListNestingHeuristics(config.getLargeListThreshold()));
        this.orphanRepairer = new OrphanContentRepairer(new ContinuationClassifier(config.getShortFragmentLength()));
    }

    /**
     * Reconstructs list nesting in place.
     *
     * @param document tree to repair
     */
    public void reconstruct(Document document) {
        int numbered = numberedParagraphs.convert(document);
        int absorbed = siblingAbsorber.absorb(document);
        int continued = orphanRepairer.attachFollowingContinuations(document);
        int repaired = orphanRepairer.repairListChildren(document);
        int wrapped = orphanRepairer.wrapStrayItems(document);
        if (wrapped > 0) {
            repaired += orphanRepairer.repairListChildren(document);
        }
        int definitions = definitionListRepairer.repair(document);

        for (Element list : document.select("ol, ul")) {
            list.attr(PROCESSED_ATTRIBUTE, "true");
        }
        log.debug("Lists: {} numbered run(s), {} absorbed, {} continuation(s), {} orphan(s), {} stray run(s), {} dl fix(es)",
            numbered, absorbed, continued, repaired, wrapped, definitions);
    }

    public static boolean isProcessed(Element list) {
        return list.hasAttr(PROCESSED_ATTRIBUTE);
    }
}
