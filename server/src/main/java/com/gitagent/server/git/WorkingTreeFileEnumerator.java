package com.gitagent.server.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the filesystem directly, so untracked and ignored-by-git files are listed too.
 * Unreadable subdirectories are skipped; an unreadable root fails the whole walk.
 */
public class WorkingTreeFileEnumerator implements FileEnumerator {

    private static final Logger log = LoggerFactory.getLogger(WorkingTreeFileEnumerator.class);

    @Override
    public Optional<List<String>> listFiles(Path root, Set<String> ignoredDirs) {
        List<String> paths = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && ignoredDirs.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isDirectory()) {
                        paths.add(root.relativize(file).toString().replace('\\', '/'));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (file.equals(root)) {
                        throw exc;
                    }
                    log.debug("Skipping unreadable {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("File enumeration failed for {}: {}", root, e.getMessage());
            return Optional.empty();
        }
        Collections.sort(paths);
        return Optional.of(paths);
    }
}
