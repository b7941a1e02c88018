package com.gitagent.server.poll;

import com.gitagent.server.git.FileEnumerator;
import com.gitagent.server.git.StatusScanner;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last known status and file-list snapshots for one working tree, plus the cursor
 * hashes of what the poller was last told.
 *
 * The snapshots are written by the watcher's debounce thread (through {@link #refresh()})
 * and by request threads (through {@link #poll}); every read and write of snapshots and
 * cursors happens under one lock per cache.
 *
 * A failed scan never clears a snapshot: once primed, the cache is stale at worst,
 * never empty.
 */
public class ChangeCache {

    private static final Logger log = LoggerFactory.getLogger(ChangeCache.class);

    private final Path           root;
    private final Set<String>    ignoredDirs;
    private final StatusScanner  statusScanner;
    private final FileEnumerator fileEnumerator;
    private final MeterRegistry  meterRegistry;
    private final ReentrantLock  lock = new ReentrantLock();

    // Guarded by lock. Null until the first successful scan / first poll.
    private StatusSnapshot   statusSnapshot;
    private FileListSnapshot fileListSnapshot;
    private Integer          lastStatusHash;
    private Integer          lastFilesHash;

    public ChangeCache(Path root,
                       Set<String> ignoredDirs,
                       StatusScanner statusScanner,
                       FileEnumerator fileEnumerator,
                       MeterRegistry meterRegistry) {
        this.root           = root;
        this.ignoredDirs    = Set.copyOf(ignoredDirs);
        this.statusScanner  = statusScanner;
        this.fileEnumerator = fileEnumerator;
        this.meterRegistry  = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Updates
    // ------------------------------------------------------------------

    /** Re-scan status and file list. This is the watcher's refresh callback. */
    public void refresh() {
        lock.lock();
        try {
            updateStatusLocked();
            updateFilesLocked();
        } finally {
            lock.unlock();
        }
    }

    /** @return true if the status snapshot was replaced, false if the scan was unavailable */
    public boolean updateStatus() {
        lock.lock();
        try {
            return updateStatusLocked();
        } finally {
            lock.unlock();
        }
    }

    /** @return true if the file-list snapshot was replaced, false if enumeration was unavailable */
    public boolean updateFiles() {
        lock.lock();
        try {
            return updateFilesLocked();
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Poll decision
    // ------------------------------------------------------------------

    /**
     * Decide what to tell the poller and advance the cursors, atomically.
     *
     * <ol>
     *   <li>force: re-scan status now and count the poll as watcher-triggered.</li>
     *   <li>Triggered with a snapshot in hand: use it as-is, the refresh that set the
     *       flag already scanned. Otherwise scan inline.</li>
     *   <li>hasChanged = triggered, or the status hash differs from the cursor
     *       (a null cursor always differs). The cursor always advances.</li>
     *   <li>Re-enumerate files only when triggered or never enumerated; filesChanged uses
     *       the same cursor rule.</li>
     *   <li>analyze = (hasChanged or force) and the status text is not blank.</li>
     * </ol>
     *
     * @param watcherTriggered result of the watcher's consume-once flag for this poll
     * @param force            caller wants current truth, not a cache hit
     */
    public PollResult poll(boolean watcherTriggered, boolean force) {
        lock.lock();
        try {
            boolean triggered = watcherTriggered;
            if (force) {
                updateStatusLocked();
                triggered = true;
            }
            if (!triggered || statusSnapshot == null) {
                updateStatusLocked();
            }

            StatusSnapshot status = statusSnapshot != null ? statusSnapshot : StatusSnapshot.EMPTY;
            int     currentHash   = status.hash();
            boolean statusChanged = lastStatusHash == null || currentHash != lastStatusHash;
            boolean hasChanged    = triggered || statusChanged;
            lastStatusHash = currentHash;

            if (triggered || fileListSnapshot == null) {
                updateFilesLocked();
            }
            boolean filesChanged = false;
            if (fileListSnapshot != null) {
                int filesHash = fileListSnapshot.hash();
                filesChanged  = lastFilesHash == null || filesHash != lastFilesHash;
                lastFilesHash = filesHash;
            }

            boolean analyze = (hasChanged || force) && !status.text().isBlank();
            return new PollResult(hasChanged, filesChanged, status.text(), analyze);
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<StatusSnapshot> statusSnapshot() {
        lock.lock();
        try {
            return Optional.ofNullable(statusSnapshot);
        } finally {
            lock.unlock();
        }
    }

    public Optional<FileListSnapshot> fileListSnapshot() {
        lock.lock();
        try {
            return Optional.ofNullable(fileListSnapshot);
        } finally {
            lock.unlock();
        }
    }

    /** Cached file list, enumerating first if no enumeration has succeeded yet. */
    public List<String> files() {
        lock.lock();
        try {
            if (fileListSnapshot == null) {
                updateFilesLocked();
            }
            return fileListSnapshot != null ? fileListSnapshot.paths() : List.of();
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Private helpers (caller holds lock)
    // ------------------------------------------------------------------

    private boolean updateStatusLocked() {
        Optional<String> scanned = meterRegistry.timer("gitagent.scan.duration", "scan", "status")
                .record(statusScanner::scan);
        if (scanned == null || scanned.isEmpty()) {
            log.warn("Status scan unavailable for {}; keeping previous snapshot", root);
            return false;
        }
        statusSnapshot = StatusSnapshot.of(scanned.get());
        return true;
    }

    private boolean updateFilesLocked() {
        Optional<List<String>> listed = meterRegistry.timer("gitagent.scan.duration", "scan", "files")
                .record(() -> fileEnumerator.listFiles(root, ignoredDirs));
        if (listed == null || listed.isEmpty()) {
            log.warn("File enumeration unavailable for {}; keeping previous snapshot", root);
            return false;
        }
        fileListSnapshot = FileListSnapshot.of(listed.get());
        return true;
    }
}
