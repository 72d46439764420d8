package com.williamcallahan.flarenormalizer.cli;

import static com.williamcallahan.flarenormalizer.service.NormalizationTestFixtures.topic;
import static com.williamcallahan.flarenormalizer.service.NormalizationTestFixtures.write;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.flarenormalizer.config.AppProperties;
import com.williamcallahan.flarenormalizer.service.NormalizationTestFixtures;
import com.williamcallahan.flarenormalizer.service.io.FileOperationsService;
import com.williamcallahan.flarenormalizer.support.DocumentTreeJsonWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NormalizeCommandTest {

    @TempDir
    Path projectRoot;

    private final NormalizeCommand command = new NormalizeCommand(
        NormalizationTestFixtures.newPipeline(),
        new FileOperationsService(new AppProperties()),
        new DocumentTreeJsonWriter());

    @Test
    void run_writesNormalizedHtmlAndJsonNextToInput() throws IOException {
        Path input = write(projectRoot.resolve("Content/Topic.htm"), topic("<p>Hello world</p>"));

        command.run(input.toString(), "--json");

        Path html = projectRoot.resolve("Content/Topic.normalized.html");
        Path json = projectRoot.resolve("Content/Topic.normalized.json");
        assertTrue(Files.isRegularFile(html));
        assertTrue(Files.readString(html, StandardCharsets.UTF_8).contains("<p>Hello world</p>"));
        JsonNode tree = new ObjectMapper().readTree(Files.readString(json, StandardCharsets.UTF_8));
        assertEquals("body", tree.get("tag").asText());
    }

    @Test
    void run_skippedDocumentProducesNoOutput() throws IOException {
        Path input = write(projectRoot.resolve("Content/Old.htm"),
            "<html><body madcap:conditions=\"Default.Deprecated\"><p>Old</p></body></html>");

        command.run(input.toString());

        assertFalse(Files.exists(projectRoot.resolve("Content/Old.normalized.html")));
    }

    @Test
    void run_missingInputIsReportedAndOtherFilesStillProcessed() throws IOException {
        Path good = write(projectRoot.resolve("Content/Good.htm"), topic("<p>Fine</p>"));
        Path missing = projectRoot.resolve("Content/Missing.htm");

        assertDoesNotThrow(() -> command.run(missing.toString(), good.toString(), "--unknown-flag"));

        assertTrue(Files.isRegularFile(projectRoot.resolve("Content/Good.normalized.html")));
        assertFalse(Files.exists(projectRoot.resolve("Content/Good.normalized.json")));
    }

    @Test
    void run_withoutFileArgumentsDoesNothing() {
        assertDoesNotThrow(() -> command.run());
        assertDoesNotThrow(() -> command.run("--json"));
    }
}
