package com.williamcallahan.flarenormalizer.service.project;

import com.williamcallahan.flarenormalizer.domain.ProjectLayout;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Locates the MadCap project that contains a source document.
 *
 * The project root is the nearest ancestor directory that holds a {@code Content} directory.
 * When no such directory exists on disk, the part of the path before {@code /Content/} is used,
 * and failing that the document's own directory. Resolution never fails.
 */
@Service
public class ProjectPathResolver {

    private static final Logger log = LoggerFactory.getLogger(ProjectPathResolver.class);
    private static final String CONTENT_DIR = "Content";
    private static final String CONTENT_SEGMENT = "/Content/";

    /**
     * Resolves the project layout for a document path.
     *
     * @param inputPath path of a source document inside the project
     * @return best-effort project layout
     */
    public ProjectLayout resolve(Path inputPath) {
        Objects.requireNonNull(inputPath, "Input path cannot be null");
        Path absolute = inputPath.toAbsolutePath().normalize();
        Path documentDir = absolute.getParent() == null ? absolute : absolute.getParent();

        for (Path candidate = documentDir; candidate != null && candidate.getParent() != null;
             candidate = candidate.getParent()) {
            if (Files.isDirectory(candidate.resolve(CONTENT_DIR))) {
                return ProjectLayout.forRoot(candidate);
            }
        }

        String pathText = absolute.toString().replace('\\', '/');
        int contentIndex = pathText.indexOf(CONTENT_SEGMENT);
        if (contentIndex > 0) {
            log.debug("No Content directory on disk for {}, using path prefix", absolute);
            return ProjectLayout.forRoot(Path.of(pathText.substring(0, contentIndex)));
        }

        log.debug("No MadCap project found for {}, using document directory", absolute);
        return ProjectLayout.forRoot(documentDir);
    }
}
