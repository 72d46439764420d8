package com.williamcallahan.flarenormalizer.service;

import com.williamcallahan.flarenormalizer.domain.ExtractedVariable;
import com.williamcallahan.flarenormalizer.domain.NormalizedDocument;
import com.williamcallahan.flarenormalizer.domain.ProcessingContext;
import com.williamcallahan.flarenormalizer.domain.ProcessingWarning.WarningType;
import com.williamcallahan.flarenormalizer.domain.ProjectLayout;
import com.williamcallahan.flarenormalizer.service.conditions.ConditionFilter;
import com.williamcallahan.flarenormalizer.service.conditions.SkipConditionTaxonomy;
import com.williamcallahan.flarenormalizer.service.content.ContentSplitter;
import com.williamcallahan.flarenormalizer.service.finalize.StructuralFinalizer;
import com.williamcallahan.flarenormalizer.service.io.FileOperationsService;
import com.williamcallahan.flarenormalizer.service.lists.ListReconstructor;
import com.williamcallahan.flarenormalizer.service.madcap.MadCapElementTransformer;
import com.williamcallahan.flarenormalizer.service.project.ProjectPathResolver;
import com.williamcallahan.flarenormalizer.service.variables.ProjectVariables;
import com.williamcallahan.flarenormalizer.service.variables.VariableStore;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns raw MadCap Flare source into a normalized, semantically resolved tree.
 *
 * Passes run in a fixed order on one parsed tree: condition filtering, MadCap element
 * transformation (which inlines snippets through the same condition and transform passes),
 * list reconstruction, content splitting and structural finalization. Each call gets its own
 * {@link NormalizationRun}; the variable and snippet caches behind the collaborating services
 * are shared, so documents of a batch may be normalized concurrently.
 */
@Service
public class NormalizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(NormalizationPipeline.class);

    private final MadCapSourceParser sourceParser;
    private final ProjectPathResolver projectPathResolver;
    private final VariableStore variableStore;
    private final SkipConditionTaxonomy skipConditionTaxonomy;
    private final ConditionFilter conditionFilter;
    private final MadCapElementTransformer elementTransformer;
    private final ListReconstructor listReconstructor;
    private final ContentSplitter contentSplitter;
    private final StructuralFinalizer structuralFinalizer;
    private final FileOperationsService fileOperations;
    private final Map<String, ExtractedVariable> extractedVariables = new ConcurrentHashMap<>();

    public NormalizationPipeline(MadCapSourceParser sourceParser,
                                 ProjectPathResolver projectPathResolver,
                                 VariableStore variableStore,
                                 SkipConditionTaxonomy skipConditionTaxonomy,
                                 ConditionFilter conditionFilter,
                                 MadCapElementTransformer elementTransformer,
                                 ListReconstructor listReconstructor,
                                 ContentSplitter contentSplitter,
                                 StructuralFinalizer structuralFinalizer,
                                 FileOperationsService fileOperations) {
        this.sourceParser = sourceParser;
        this.projectPathResolver = projectPathResolver;
        this.variableStore = variableStore;
        this.skipConditionTaxonomy = skipConditionTaxonomy;
        this.conditionFilter = conditionFilter;
        this.elementTransformer = elementTransformer;
        this.listReconstructor = listReconstructor;
        this.contentSplitter = contentSplitter;
        this.structuralFinalizer = structuralFinalizer;
        this.fileOperations = fileOperations;
    }

    /**
     * Normalizes one document.
     *
     * @param rawHtml MadCap source markup
     * @param inputPath source file, or null when converting a string without project context
     * @param context processing options, null for defaults
     * @return the normalized tree with its warnings
     * @throws DocumentNormalizationException when the document cannot be processed at all
     */
    public NormalizedDocument preprocess(String rawHtml, Path inputPath, ProcessingContext context) {
        if (rawHtml == null) {
            throw new DocumentNormalizationException("Document content cannot be null", inputPath);
        }
        ProcessingContext options = context == null ? ProcessingContext.defaults() : context;
        try {
            NormalizationRun run = openRun(inputPath, options);
            Document document = sourceParser.parse(rawHtml);
            int removed = conditionFilter.apply(document, options);
            elementTransformer.transform(document, run, this::processSnippet);
            listReconstructor.reconstruct(document);
            contentSplitter.split(document);
            structuralFinalizer.finalizeDocument(document, run);

            for (ExtractedVariable variable : run.extractedVariables()) {
                extractedVariables.putIfAbsent(variable.name(), variable);
            }
            log.info("Normalized {} ({} conditional element(s) removed, {} warning(s))",
                inputPath == null ? "<string input>" : inputPath, removed, run.warnings().size());
            return new NormalizedDocument(document, run.warnings(), run.extractedVariables(), inputPath);
        } catch (DocumentNormalizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DocumentNormalizationException("Failed to normalize document: " + e.getMessage(), inputPath, e);
        }
    }

    /**
     * Reads and normalizes a source file.
     *
     * @throws DocumentNormalizationException when the file cannot be read or processed
     */
    public NormalizedDocument preprocess(Path inputPath, ProcessingContext context) {
        String rawHtml;
        try {
            rawHtml = fileOperations.readTextFile(inputPath);
        } catch (IOException e) {
            throw new DocumentNormalizationException("Failed to read document: " + e.getMessage(), inputPath, e);
        }
        return preprocess(rawHtml, inputPath, context);
    }

    /**
     * Cheap raw-text check letting a batch runner skip a document whose conditions mark it as
     * excluded, without parsing it.
     */
    public boolean shouldSkipDocument(String rawHtml) {
        return rawHtml != null && skipConditionTaxonomy.shouldSkipDocument(rawHtml);
    }

    /**
     * Returns the variables recorded by extract-mode runs since the last clear, sorted by name.
     */
    public List<ExtractedVariable> getExtractedVariables() {
        List<ExtractedVariable> variables = new ArrayList<>(extractedVariables.values());
        variables.sort((left, right) -> left.name().compareTo(right.name()));
        return variables;
    }

    public void clearExtractedVariables() {
        extractedVariables.clear();
    }

    private NormalizationRun openRun(Path inputPath, ProcessingContext context) {
        if (inputPath == null) {
            return new NormalizationRun(context, null, null, ProjectVariables.empty());
        }
        ProjectLayout layout = projectPathResolver.resolve(inputPath);
        ProjectVariables variables = variableStore.loadVariableSets(layout.root());
        NormalizationRun run = new NormalizationRun(context, inputPath, layout, variables);
        for (String problem : variables.loadProblems()) {
            run.warn(WarningType.VARIABLE_SET_UNREADABLE, problem, layout.variableSetsDir().toString());
        }
        return run;
    }

    private List<Node> processSnippet(String bodyHtml, Path snippetPath, NormalizationRun run) {
        Document snippet = sourceParser.parse(bodyHtml);
        conditionFilter.apply(snippet, run.context());
        elementTransformer.transform(snippet, run, this::processSnippet);
        List<Node> nodes = DomNodes.childNodesSnapshot(snippet.body());
        for (Node node : nodes) {
            node.remove();
        }
        return nodes;
    }
}
