package com.webspec.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Finds feature files for a batch run.
 *
 * <ul>
 *   <li>A single file with the feature extension is returned on its own.</li>
 *   <li>A single file with any other extension is rejected.</li>
 *   <li>A directory is walked recursively (depth 10, following symbolic links);
 *       entries that cannot be read are logged and skipped.</li>
 *   <li>A path that does not exist yields an empty list.</li>
 * </ul>
 * Results are sorted lexicographically.
 */
public final class FeatureDiscovery {

    private static final Logger log = LoggerFactory.getLogger(FeatureDiscovery.class);

    public static final String DEFAULT_EXTENSION = ".feature";
    public static final int    MAX_DEPTH         = 10;

    private FeatureDiscovery() {}

    public static List<Path> discover(Path root) throws IOException {
        return discover(root, DEFAULT_EXTENSION);
    }

    /**
     * @throws IllegalArgumentException if {@code root} is a regular file without the extension
     */
    public static List<Path> discover(Path root, String extension) throws IOException {
        if (Files.isRegularFile(root)) {
            if (hasExtension(root, extension)) return List.of(root);
            throw new IllegalArgumentException("Path is not a feature file: " + root);
        }
        if (!Files.isDirectory(root)) {
            log.warn("FeatureDiscovery: {} does not exist - nothing to run", root);
            return List.of();
        }

        List<Path> found = new ArrayList<>();
        Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), MAX_DEPTH,
            new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && hasExtension(file, extension)) found.add(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("FeatureDiscovery: could not access {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });

        found.sort(null);
        log.info("FeatureDiscovery: {} feature file(s) under {}", found.size(), root);
        return found;
    }

    private static boolean hasExtension(Path path, String extension) {
        Path name = path.getFileName();
        return name != null && name.toString().endsWith(extension);
    }
}
