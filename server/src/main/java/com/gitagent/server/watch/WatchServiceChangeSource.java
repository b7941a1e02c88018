package com.gitagent.server.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * {@link ChangeSource} backed by the JDK {@link WatchService}.
 *
 * The JDK service is not recursive, so every directory under the root is registered
 * up front (ignored names are pruned) and directories created later are registered as
 * their ENTRY_CREATE event is drained.
 *
 * {@link WatchService#take()} unblocks with {@link ClosedWatchServiceException} when the
 * service is closed from another thread, which is how {@link #close()} ends a blocked read.
 */
public class WatchServiceChangeSource implements ChangeSource {

    private static final Logger log = LoggerFactory.getLogger(WatchServiceChangeSource.class);

    private final Path          root;
    private final Set<String>   ignoredDirs;
    private final WatchService  watchService;
    private final AtomicBoolean closed = new AtomicBoolean();

    private WatchServiceChangeSource(Path root, Set<String> ignoredDirs, WatchService watchService) {
        this.root         = root;
        this.ignoredDirs  = ignoredDirs;
        this.watchService = watchService;
    }

    /**
     * Open a watch service on {@code root} and register its directory tree.
     *
     * @throws IOException if the platform has no watch service or the root cannot be registered
     */
    public static WatchServiceChangeSource open(Path root, Set<String> ignoredDirs) throws IOException {
        WatchService watchService = root.getFileSystem().newWatchService();
        WatchServiceChangeSource source = new WatchServiceChangeSource(root, ignoredDirs, watchService);
        try {
            source.registerTree(root);
        } catch (IOException | RuntimeException e) {
            source.close();
            throw e;
        }
        log.debug("JDK watch service registered for {}", root);
        return source;
    }

    @Override
    public int awaitChanges() throws IOException, InterruptedException {
        try {
            WatchKey key = watchService.take();
            int relevant = drain(key);
            // Pick up whatever else is already queued so one burst is one batch.
            WatchKey next;
            while ((next = watchService.poll()) != null) {
                relevant += drain(next);
            }
            return relevant;
        } catch (ClosedWatchServiceException e) {
            throw new ChangeSourceClosedException(root, e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close watch service for {}: {}", root, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private int drain(WatchKey key) {
        Path dir = (Path) key.watchable();
        int relevant = 0;
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == OVERFLOW) {
                // Events were dropped; the only safe answer is "something changed".
                relevant++;
                continue;
            }
            if (!(event.context() instanceof Path name)) {
                continue;
            }
            Path changed = dir.resolve(name);
            if (IgnoredPaths.isIgnored(root, changed, ignoredDirs)) {
                continue;
            }
            relevant++;

            if (event.kind() == ENTRY_CREATE && Files.isDirectory(changed, LinkOption.NOFOLLOW_LINKS)) {
                try {
                    registerTree(changed);
                } catch (IOException e) {
                    log.warn("Failed to register new directory {} for watching: {}", changed, e.getMessage());
                }
            }
        }
        if (!key.reset()) {
            log.debug("Watch key no longer valid: {}", dir);
        }
        return relevant;
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(root) && ignoredDirs.contains(String.valueOf(dir.getFileName()))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                dir.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (file.equals(root)) throw exc;
                // Deleted between listing and visiting; the delete event covers it.
                log.debug("Skipping {} while registering watch: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
