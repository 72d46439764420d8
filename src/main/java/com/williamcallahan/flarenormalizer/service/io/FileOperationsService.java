package com.williamcallahan.flarenormalizer.service.io;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.williamcallahan.flarenormalizer.config.AppProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Centralized service for reading and writing project files.
 *
 * Reads of project sources (variable sets and snippets) go through a bounded cache keyed by
 * path and modification time, so a batch run touching the same snippet from many topics reads it
 * once while an edited file is picked up on the next access.
 */
@Service
public class FileOperationsService {

    private static final Logger log = LoggerFactory.getLogger(FileOperationsService.class);

    private final Cache<FileKey, String> contentCache;

    public FileOperationsService(AppProperties appProperties) {
        this.contentCache = Caffeine.newBuilder()
            .maximumSize(appProperties.getNormalizer().getCache().getFileContentMaxEntries())
            .recordStats()
            .build();
    }

    /**
     * Reads a UTF-8 text file, serving unchanged files from the cache.
     *
     * @param filePath The path to the file
     * @return The file content as a string
     * @throws IOException If the file cannot be read
     */
    public String readCachedTextFile(Path filePath) throws IOException {
        Path normalized = filePath.toAbsolutePath().normalize();
        FileTime modified = Files.getLastModifiedTime(normalized);
        FileKey key = new FileKey(normalized, modified.toMillis());
        String cached = contentCache.getIfPresent(key);
        if (cached != null) {
            log.debug("File content cache hit for {}", normalized);
            return cached;
        }
        String content = readTextFile(normalized);
        contentCache.put(key, content);
        return content;
    }

    /**
     * Reads text content from a file without caching.
     *
     * Bytes that are not valid UTF-8, such as Windows-1252 quotes in legacy topics, decode to
     * U+FFFD instead of failing the read.
     *
     * @param filePath The path to the file
     * @return The file content as a string
     * @throws IOException If file operations fail
     */
    public String readTextFile(Path filePath) throws IOException {
        return new String(Files.readAllBytes(filePath), StandardCharsets.UTF_8);
    }

    /**
     * Saves text content to a file, creating parent directories as needed.
     *
     * @param filePath The path to the file
     * @param content The text content to write
     * @throws IOException If file operations fail
     */
    public void saveTextFile(Path filePath, String content) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Checks if a regular file exists.
     *
     * @param filePath The path to check
     * @return true if the file exists, false otherwise
     */
    public boolean fileExists(Path filePath) {
        return Files.isRegularFile(filePath);
    }

    public CacheStats cacheStats() {
        return contentCache.stats();
    }

    private record FileKey(Path path, long modifiedMillis) {
    }
}
