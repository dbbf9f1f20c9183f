package com.qualitylens.core.util;

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
import java.util.List;
import java.util.Set;

/**
 * Source file discovery for project runs.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    /**
     * Directory names never descended into: dependencies, build output and VCS metadata.
     */
    public static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
        "node_modules", ".git", "dist", "build", ".next", "coverage"
    );

    private FileUtils() {
        // Utility class
    }

    /**
     * Collects regular files below {@code rootPath} whose root-relative path matches the glob.
     *
     * <p>Directories named in {@link #EXCLUDED_DIRECTORIES} are pruned. Symbolic links are
     * not followed. Entries that cannot be read are logged and skipped; the walk goes on.
     * The result is sorted so project runs visit files in a stable order.
     *
     * @param rootPath project root
     * @param globPattern glob matched against the path relative to the root
     * @return sorted matching files
     * @throws IOException if the root itself cannot be walked
     */
    public static List<Path> findSourceFiles(Path rootPath, String globPattern) throws IOException {
        SourceFileCollector collector = new SourceFileCollector(rootPath, globPattern);
        Files.walkFileTree(rootPath, collector);
        return collector.sortedMatches();
    }

    static final class SourceFileCollector extends SimpleFileVisitor<Path> {

        private final Path rootPath;
        private final PathMatcher matcher;
        private final List<Path> matches = new ArrayList<>();
        private int failedEntries;

        SourceFileCollector(Path rootPath, String globPattern) {
            this.rootPath = rootPath;
            this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(rootPath) && EXCLUDED_DIRECTORIES.contains(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && matcher.matches(rootPath.relativize(file))) {
                matches.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(rootPath)) {
                throw exc;
            }
            failedEntries++;
            log.warn("Skipping unreadable entry {}: {}",
                Sanitizers.sanitizePath(file.toString()), Sanitizers.sanitizeError(exc));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                failedEntries++;
                log.warn("Directory {} was only partially listed: {}",
                    Sanitizers.sanitizePath(dir.toString()), Sanitizers.sanitizeError(exc));
            }
            return FileVisitResult.CONTINUE;
        }

        int failedEntries() {
            return failedEntries;
        }

        List<Path> sortedMatches() {
            List<Path> sorted = new ArrayList<>(matches);
            sorted.sort(null);
            return sorted;
        }
    }
}
