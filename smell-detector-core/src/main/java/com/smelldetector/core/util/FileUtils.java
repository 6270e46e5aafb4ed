package com.smelldetector.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>Patterns are matched against the path relative to {@code rootPath}; {@code **.py}
     * matches Python files at any depth.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return matching paths, sorted
     * @throws IOException if the root directory cannot be traversed
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        return findFiles(rootPath, globPattern, List.of());
    }

    /**
     * Finds files matching a glob pattern, skipping those matching any exclude pattern.
     *
     * <p>Entries below the root that cannot be read are logged and skipped.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern of files to include
     * @param excludePatterns glob patterns of files to skip
     * @return matching paths, sorted
     * @throws IOException if the root directory cannot be traversed
     */
    public static List<Path> findFiles(Path rootPath, String globPattern, List<String> excludePatterns) throws IOException {
        MatchingFileCollector collector = new MatchingFileCollector(rootPath, globPattern, excludePatterns);
        Files.walkFileTree(rootPath, collector);
        return collector.matches();
    }

    static final class MatchingFileCollector extends SimpleFileVisitor<Path> {

        private final Path rootPath;
        private final PathMatcher include;
        private final List<PathMatcher> excludes;
        private final List<Path> found = new ArrayList<>();

        MatchingFileCollector(Path rootPath, String globPattern, List<String> excludePatterns) {
            this.rootPath = rootPath;
            this.include = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
            this.excludes = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
                Path relativePath = rootPath.relativize(file);
                if (include.matches(relativePath)
                    && excludes.stream().noneMatch(exclude -> exclude.matches(relativePath))) {
                    found.add(file);
                }
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(rootPath)) {
                throw exc;
            }
            log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                log.warn("Directory listing of {} ended early: {}", dir, exc.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }

        List<Path> matches() {
            return found.stream()
                .sorted(Comparator.comparing(Path::toString))
                .toList();
        }
    }
}
