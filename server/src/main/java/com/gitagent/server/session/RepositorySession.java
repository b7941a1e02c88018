package com.gitagent.server.session;

import com.gitagent.server.config.WatcherSettings;
import com.gitagent.server.git.GitClient;
import com.gitagent.server.git.GitOperations;
import com.gitagent.server.git.GitStatusScanner;
import com.gitagent.server.git.WorkingTreeFileEnumerator;
import com.gitagent.server.git.WorkingTreeFiles;
import com.gitagent.server.poll.ChangeCache;
import com.gitagent.server.poll.PollCoordinator;
import com.gitagent.server.watch.ChangeSourceFactory;
import com.gitagent.server.watch.ChangeSources;
import com.gitagent.server.watch.DirectoryWatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;

/**
 * Everything bound to one selected working tree: git access, the change cache, the
 * directory watcher feeding it and the poll coordinator reading it.
 *
 * A session lives from repository selection until the next selection (or shutdown);
 * {@link #close()} stops its watcher and nothing else needs releasing.
 */
public class RepositorySession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RepositorySession.class);

    static final String MDC_REPO = "repo";

    private final Path             root;
    private final GitOperations    git;
    private final WorkingTreeFiles files;
    private final ChangeCache      cache;
    private final DirectoryWatcher watcher;
    private final PollCoordinator  poller;
    private final Counter          refreshes;

    private RepositorySession(Path root, WatcherSettings settings,
                              ChangeSourceFactory sourceFactory, MeterRegistry meterRegistry) {
        GitClient client = new GitClient(root, settings.gitCommandTimeout());

        this.root      = root;
        this.git       = new GitOperations(client);
        this.files     = new WorkingTreeFiles(root);
        this.cache     = new ChangeCache(root, settings.ignoredDirs(),
                new GitStatusScanner(client), new WorkingTreeFileEnumerator(), meterRegistry);
        this.watcher   = new DirectoryWatcher(sourceFactory, settings.stopTimeout());
        this.poller    = new PollCoordinator(cache, watcher, meterRegistry);
        this.refreshes = meterRegistry.counter("gitagent.watcher.refreshes");
    }

    /**
     * Open a session and start watching. Returns once the cache has been primed, whether
     * or not a change source could be acquired.
     */
    public static RepositorySession open(Path root, WatcherSettings settings, MeterRegistry meterRegistry) {
        ChangeSourceFactory sources = ChangeSources.forMode(
                settings.mode(), settings.ignoredDirs(), settings.pollInterval());
        return open(root, settings, sources, meterRegistry);
    }

    static RepositorySession open(Path root, WatcherSettings settings,
                                  ChangeSourceFactory sourceFactory, MeterRegistry meterRegistry) {
        RepositorySession session = new RepositorySession(root, settings, sourceFactory, meterRegistry);
        session.watcher.start(root, session::onFilesystemChange, settings.debounce());
        log.info("Opened session for {} (watching={})", root, session.watcher.isWatching());
        return session;
    }

    // Runs on the watcher's debounce thread, or on the caller's thread while priming.
    private void onFilesystemChange() {
        MDC.put(MDC_REPO, root.getFileName() != null ? root.getFileName().toString() : root.toString());
        try {
            cache.refresh();
            refreshes.increment();
        } finally {
            MDC.remove(MDC_REPO);
        }
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public Path root() {
        return root;
    }

    public GitOperations git() {
        return git;
    }

    public WorkingTreeFiles files() {
        return files;
    }

    public ChangeCache cache() {
        return cache;
    }

    public PollCoordinator poller() {
        return poller;
    }

    public boolean isWatching() {
        return watcher.isWatching();
    }

    @Override
    public void close() {
        watcher.stop();
        log.info("Closed session for {}", root);
    }
}
