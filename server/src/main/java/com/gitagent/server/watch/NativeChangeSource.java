package com.gitagent.server.watch;

import io.methvin.watcher.DirectoryChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ChangeSource} using the io.methvin directory-watcher library, which watches
 * recursively with the platform's own API:
 * <ul>
 *   <li>macOS   : FSEvents (one stream for the whole tree)</li>
 *   <li>Linux   : inotify</li>
 *   <li>Windows : WatchService with FILE_TREE</li>
 * </ul>
 *
 * The library delivers events to a listener on its own thread; the listener only
 * enqueues them, and {@link #awaitChanges()} is the blocking read of that queue.
 */
public class NativeChangeSource implements ChangeSource {

    private static final Logger log = LoggerFactory.getLogger(NativeChangeSource.class);

    /** Queue element: a relevant event, or the marker that close() has run. */
    private record Signal(boolean closed) {
        static final Signal CHANGE = new Signal(false);
        static final Signal CLOSED = new Signal(true);
    }

    private final Path                                   root;
    private final Set<String>                            ignoredDirs;
    private final BlockingQueue<Signal>                  queue  = new LinkedBlockingQueue<>();
    private final AtomicBoolean                          closed = new AtomicBoolean();
    private final io.methvin.watcher.DirectoryWatcher    watcher;
    private final ExecutorService                        listenerThread;

    private NativeChangeSource(Path root, Set<String> ignoredDirs) throws IOException {
        this.root        = root;
        this.ignoredDirs = ignoredDirs;
        this.watcher = io.methvin.watcher.DirectoryWatcher.builder()
                .path(root)
                .fileHashing(false)     // only "did something change" matters here
                .listener(this::onEvent)
                .build();
        this.listenerThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "native-watch-" + root.getFileName());
            t.setDaemon(true);
            return t;
        });
    }

    /** @throws IOException if the native watcher cannot be created for {@code root} */
    public static NativeChangeSource open(Path root, Set<String> ignoredDirs) throws IOException {
        NativeChangeSource source = new NativeChangeSource(root, ignoredDirs);
        // Paths are registered before watchAsync returns; a registration failure comes
        // back as an already-failed future rather than an exception.
        CompletableFuture<Void> watching = source.watcher.watchAsync(source.listenerThread);
        if (watching.isCompletedExceptionally()) {
            source.close();
            Throwable cause = failureOf(watching);
            throw new IOException("Cannot watch " + root + ": " + cause.getMessage(), cause);
        }
        watching.whenComplete((ignored, error) -> {
            if (error != null && !source.closed.get()) {
                log.warn("Native directory watcher for {} stopped unexpectedly", root, error);
            }
        });
        log.debug("Native directory watcher started for {}", root);
        return source;
    }

    private static Throwable failureOf(CompletableFuture<Void> failed) {
        try {
            failed.join();
            return new IllegalStateException("watch future did not fail");
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            return e;
        }
    }

    @Override
    public int awaitChanges() throws IOException, InterruptedException {
        Signal first = queue.take();
        List<Signal> batch = new ArrayList<>();
        batch.add(first);
        queue.drainTo(batch);
        for (Signal s : batch) {
            if (s.closed()) {
                queue.offer(Signal.CLOSED);   // keep later calls failing too
                throw new ChangeSourceClosedException(root);
            }
        }
        return batch.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            watcher.close();
        } catch (IOException e) {
            log.warn("Failed to close native directory watcher for {}: {}", root, e.getMessage());
        } finally {
            listenerThread.shutdownNow();
            queue.offer(Signal.CLOSED);
        }
    }

    private void onEvent(DirectoryChangeEvent event) {
        if (closed.get()) return;
        if (event.eventType() == DirectoryChangeEvent.EventType.OVERFLOW) {
            queue.offer(Signal.CHANGE);
            return;
        }
        Path path = event.path();
        if (path == null || IgnoredPaths.isIgnored(root, path, ignoredDirs)) {
            log.trace("Skipping event for ignored path: {}", path);
            return;
        }
        queue.offer(Signal.CHANGE);
    }
}
