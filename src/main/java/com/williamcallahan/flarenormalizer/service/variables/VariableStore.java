package com.williamcallahan.flarenormalizer.service.variables;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.flarenormalizer.config.AppProperties;
import com.williamcallahan.flarenormalizer.domain.ProjectLayout;
import com.williamcallahan.flarenormalizer.domain.VariableSet;
import com.williamcallahan.flarenormalizer.service.io.FileOperationsService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Loads and caches the variable sets of MadCap projects.
 *
 * Entries are keyed by project root plus a fingerprint of the {@code .flvar} files (names and
 * modification times), so an edited variable set is reloaded while unchanged projects are served
 * from memory. Concurrent loads of the same project may both parse the files; the results are
 * equal and the later write simply replaces the earlier one.
 */
@Service
public class VariableStore {

    private static final Logger log = LoggerFactory.getLogger(VariableStore.class);
    private static final String FLVAR_EXTENSION = ".flvar";
    private static final String RESOURCE_FORK_PREFIX = "._";

    private final FileOperationsService fileOperations;
    private final FlvarParser flvarParser;
    private final Cache<ProjectKey, ProjectVariables> projectCache;

    public VariableStore(FileOperationsService fileOperations, FlvarParser flvarParser, AppProperties appProperties) {
        this.fileOperations = fileOperations;
        this.flvarParser = flvarParser;
        this.projectCache = Caffeine.newBuilder()
            .maximumSize(appProperties.getNormalizer().getCache().getVariableProjectMaxEntries())
            .recordStats()
            .build();
    }

    /**
     * Loads every variable set of the project rooted at {@code root}.
     *
     * Files that cannot be read or parsed are skipped and reported through
     * {@link ProjectVariables#loadProblems()}.
     *
     * @param root project root, the directory containing {@code Content}
     * @return merged project variables, empty when the project has no variable sets
     */
    public ProjectVariables loadVariableSets(Path root) {
        ProjectLayout layout = ProjectLayout.forRoot(root);
        Path variableSetsDir = layout.variableSetsDir();
        if (!Files.isDirectory(variableSetsDir)) {
            log.debug("No variable sets directory at {}", variableSetsDir);
            return ProjectVariables.empty();
        }

        List<Path> files;
        try {
            files = listVariableSetFiles(variableSetsDir);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not list variable sets in {}: {}", variableSetsDir, e.getMessage());
            return new ProjectVariables(List.of(),
                List.of("Could not list variable sets in " + variableSetsDir + ": " + e.getMessage()));
        }

        ProjectKey key = new ProjectKey(layout.root(), fingerprint(files));
        ProjectVariables cached = projectCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        ProjectVariables loaded = load(files);
        projectCache.put(key, loaded);
        log.info("Loaded {} variables from {} variable set(s) under {}",
            loaded.size(), loaded.sets().size(), variableSetsDir);
        return loaded;
    }

    private ProjectVariables load(List<Path> files) {
        List<VariableSet> sets = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        for (Path file : files) {
            try {
                String content = fileOperations.readCachedTextFile(file);
                sets.add(flvarParser.parse(file, content));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Could not load variable set {}: {}", file, e.getMessage());
                problems.add("Could not load variable set " + file.getFileName() + ": " + e.getMessage());
            }
        }
        return new ProjectVariables(sets, problems);
    }

    private static List<Path> listVariableSetFiles(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.endsWith(FLVAR_EXTENSION) && !name.startsWith(RESOURCE_FORK_PREFIX);
                })
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
        }
    }

    private static String fingerprint(List<Path> files) {
        StringBuilder fingerprint = new StringBuilder();
        for (Path file : files) {
            long modified;
            try {
                modified = Files.getLastModifiedTime(file).toMillis();
            } catch (IOException e) {
                // reported by load() when the read fails too
                modified = -1L;
            }
            fingerprint.append(file.getFileName()).append('@').append(modified).append(';');
        }
        return fingerprint.toString();
    }

    private record ProjectKey(Path root, String fingerprint) {
    }
}
