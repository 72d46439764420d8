package com.williamcallahan.flarenormalizer.cli;

import com.williamcallahan.flarenormalizer.domain.NormalizedDocument;
import com.williamcallahan.flarenormalizer.domain.ProcessingContext;
import com.williamcallahan.flarenormalizer.domain.ProcessingWarning;
import com.williamcallahan.flarenormalizer.service.DocumentNormalizationException;
import com.williamcallahan.flarenormalizer.service.NormalizationPipeline;
import com.williamcallahan.flarenormalizer.service.io.FileOperationsService;
import com.williamcallahan.flarenormalizer.support.DocumentTreeJsonWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Normalizes the MadCap files named on the command line.
 *
 * For each {@code Topic.htm} argument writes {@code Topic.normalized.html} next to it, plus
 * {@code Topic.normalized.json} when {@code --json} is given. Files flagged by the skip
 * taxonomy are reported and left alone. Without file arguments the command does nothing.
 */
@Component
public class NormalizeCommand implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(NormalizeCommand.class);

    private static final String JSON_FLAG = "--json";
    private static final String EXTRACT_VARIABLES_FLAG = "--extract-variables";

    private final NormalizationPipeline pipeline;
    private final FileOperationsService fileOperations;
    private final DocumentTreeJsonWriter jsonWriter;

    public NormalizeCommand(NormalizationPipeline pipeline, FileOperationsService fileOperations,
                            DocumentTreeJsonWriter jsonWriter) {
        this.pipeline = pipeline;
        this.fileOperations = fileOperations;
        this.jsonWriter = jsonWriter;
    }

    @Override
    public void run(String... args) {
        boolean writeJson = false;
        boolean extractVariables = false;
        List<Path> inputs = new ArrayList<>();
        for (String arg : args) {
            if (JSON_FLAG.equals(arg)) {
                writeJson = true;
            } else if (EXTRACT_VARIABLES_FLAG.equals(arg)) {
                extractVariables = true;
            } else if (!arg.startsWith("--")) {
                inputs.add(Paths.get(arg));
            }
        }
        if (inputs.isEmpty()) {
            return;
        }

        ProcessingContext context = ProcessingContext.defaults().withExtractVariables(extractVariables);
        int normalized = 0;
        int failed = 0;
        for (Path input : inputs) {
            try {
                if (normalizeFile(input, context, writeJson)) {
                    normalized++;
                }
            } catch (DocumentNormalizationException | IOException e) {
                log.error("Error normalizing {}: {}", input, e.getMessage());
                log.debug("Stack trace:", e);
                failed++;
            }
        }
        if (extractVariables) {
            pipeline.getExtractedVariables().forEach(variable ->
                log.info("Variable {} = {}", variable.name(), variable.value()));
        }
        log.info("Normalized {} file(s), {} failed", normalized, failed);
    }

    private boolean normalizeFile(Path input, ProcessingContext context, boolean writeJson) throws IOException {
        String raw = fileOperations.readTextFile(input);
        if (pipeline.shouldSkipDocument(raw)) {
            log.info("Skipping {} (excluded by condition tags)", input);
            return false;
        }
        NormalizedDocument result = pipeline.preprocess(raw, input, context);
        for (ProcessingWarning warning : result.warnings()) {
            log.warn("{}: {} {}", input.getFileName(), warning.type(), warning.message());
        }
        String baseName = stripExtension(input.getFileName().toString());
        Path htmlOut = input.resolveSibling(baseName + ".normalized.html");
        fileOperations.saveTextFile(htmlOut, result.html());
        log.info("Wrote {}", htmlOut);
        if (writeJson) {
            Path jsonOut = input.resolveSibling(baseName + ".normalized.json");
            fileOperations.saveTextFile(jsonOut, jsonWriter.write(result.document()));
            log.info("Wrote {}", jsonOut);
        }
        return true;
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
