package com.williamcallahan.flarenormalizer.service.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.flarenormalizer.config.AppProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileOperationsServiceTest {

    @TempDir
    Path tempDir;

    private final FileOperationsService fileOperations = new FileOperationsService(new AppProperties());

    @Test
    void saveTextFile_createsParentDirectories() throws IOException {
        Path target = tempDir.resolve("out/nested/Topic.normalized.html");

        fileOperations.saveTextFile(target, "<p>café</p>");

        assertTrue(fileOperations.fileExists(target));
        assertEquals("<p>café</p>", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    void readTextFile_invalidUtf8BytesBecomeReplacementCharacter() throws IOException {
        Path topic = tempDir.resolve("Legacy.htm");
        byte[] prefix = "Don".getBytes(StandardCharsets.US_ASCII);
        byte[] suffix = "t panic".getBytes(StandardCharsets.US_ASCII);
        byte[] content = new byte[prefix.length + 1 + suffix.length];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        content[prefix.length] = (byte) 0x92;
        System.arraycopy(suffix, 0, content, prefix.length + 1, suffix.length);
        Files.write(topic, content);

        assertEquals("Don\uFFFDt panic", fileOperations.readTextFile(topic));
        assertEquals("Don\uFFFDt panic", fileOperations.readCachedTextFile(topic));
    }

    @Test
    void readCachedTextFile_servesUnchangedFileFromCache() throws IOException {
        Path snippet = tempDir.resolve("Snippet.flsnp");
        Files.writeString(snippet, "<p>one</p>", StandardCharsets.UTF_8);

        assertEquals("<p>one</p>", fileOperations.readCachedTextFile(snippet));
        assertEquals("<p>one</p>", fileOperations.readCachedTextFile(snippet));

        assertEquals(1, fileOperations.cacheStats().hitCount());
    }

    @Test
    void readCachedTextFile_rereadsFileAfterModification() throws IOException {
        Path snippet = tempDir.resolve("Snippet.flsnp");
        Files.writeString(snippet, "<p>one</p>", StandardCharsets.UTF_8);
        fileOperations.readCachedTextFile(snippet);

        Files.writeString(snippet, "<p>two</p>", StandardCharsets.UTF_8);
        Files.setLastModifiedTime(snippet, FileTime.fromMillis(Files.getLastModifiedTime(snippet).toMillis() + 5_000));

        assertEquals("<p>two</p>", fileOperations.readCachedTextFile(snippet));
    }

    @Test
    void readCachedTextFile_missingFileThrows() {
        Path missing = tempDir.resolve("Missing.flsnp");

        assertFalse(fileOperations.fileExists(missing));
        assertThrows(IOException.class, () -> fileOperations.readCachedTextFile(missing));
    }
}
