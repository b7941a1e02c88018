package com.gitagent.server.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Timed re-scan fallback for platforms without a usable notification API.
 *
 * Every {@code interval} the tree is fingerprinted (relative path, size, modification
 * time) and compared with the previous fingerprint. The wait is on a latch that
 * {@link #close()} releases, so a blocked read ends as soon as the source is closed.
 */
public class PollingChangeSource implements ChangeSource {

    private static final Logger log = LoggerFactory.getLogger(PollingChangeSource.class);

    private record Entry(long size, long modifiedMillis) {}

    private final Path           root;
    private final Set<String>    ignoredDirs;
    private final Duration       interval;
    private final CountDownLatch closedLatch = new CountDownLatch(1);

    // Only read and written by the thread calling awaitChanges().
    private Map<String, Entry> lastSeen;

    public PollingChangeSource(Path root, Set<String> ignoredDirs, Duration interval) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + interval);
        }
        this.root        = root;
        this.ignoredDirs = ignoredDirs;
        this.interval    = interval;
        this.lastSeen    = fingerprint();
        log.debug("Polling change source for {} every {} ms ({} entries)",
                root, interval.toMillis(), lastSeen.size());
    }

    @Override
    public int awaitChanges() throws IOException, InterruptedException {
        while (true) {
            if (closedLatch.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new ChangeSourceClosedException(root);
            }
            Map<String, Entry> current = fingerprint();
            int differences = countDifferences(lastSeen, current);
            lastSeen = current;
            if (differences > 0) {
                return differences;
            }
        }
    }

    @Override
    public void close() {
        closedLatch.countDown();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Map<String, Entry> fingerprint() throws IOException {
        Map<String, Entry> entries = new HashMap<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && ignoredDirs.contains(String.valueOf(dir.getFileName()))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (!dir.equals(root)) {
                    entries.put(key(dir), new Entry(0L, attrs.lastModifiedTime().toMillis()));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                entries.put(key(file), new Entry(attrs.size(), attrs.lastModifiedTime().toMillis()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                // Vanished mid-walk; it simply isn't part of this fingerprint.
                return FileVisitResult.CONTINUE;
            }
        });
        return entries;
    }

    private String key(Path path) {
        return root.relativize(path).toString();
    }

    private static int countDifferences(Map<String, Entry> before, Map<String, Entry> after) {
        Set<String> keys = new HashSet<>(before.keySet());
        keys.addAll(after.keySet());
        int differences = 0;
        for (String k : keys) {
            if (!Objects.equals(before.get(k), after.get(k))) {
                differences++;
            }
        }
        return differences;
    }
}
