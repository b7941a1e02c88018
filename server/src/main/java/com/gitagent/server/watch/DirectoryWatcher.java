package com.gitagent.server.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns noisy filesystem notifications for one directory tree into a debounced
 * "refresh" callback plus a consume-once change flag.
 *
 * Threads involved:
 * <ul>
 *   <li>one dedicated loop thread, blocked in {@link ChangeSource#awaitChanges()};</li>
 *   <li>one debounce timer thread that runs the callback once events stop arriving
 *       for {@code debounceInterval};</li>
 *   <li>any number of request threads calling {@link #consumeChange()}.</li>
 * </ul>
 *
 * The {@link ChangeSource} is touched only by the loop thread and by the thread running
 * {@link #stop()}. At most one debounce task is pending at any time: a new batch of raw
 * events cancels the pending task and schedules a fresh one.
 *
 * If no source can be acquired the watcher degrades to poll-only mode: the callback
 * runs once so the caller has an initial snapshot, and the change flag is never set.
 */
public class DirectoryWatcher {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);

    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(2);

    // Pause before retrying after a failed read, so a persistent error can't spin the CPU.
    private static final Duration RETRY_DELAY = Duration.ofMillis(100);

    private final ChangeSourceFactory sourceFactory;
    private final Duration            stopTimeout;

    private final AtomicBoolean changed   = new AtomicBoolean();
    private final Object        timerLock = new Object();

    // Lifecycle state, guarded by `this`.
    private boolean      started;
    private ChangeSource source;
    private Thread       loopThread;

    // Written once in start() before the loop thread exists.
    private volatile Path                         root;
    private volatile Runnable                     callback;
    private volatile Duration                     debounceInterval;
    private volatile ScheduledThreadPoolExecutor  timer;
    private volatile boolean                      running;

    // Guarded by timerLock.
    private ScheduledFuture<?> pending;
    private long               generation;

    public DirectoryWatcher(ChangeSourceFactory sourceFactory) {
        this(sourceFactory, DEFAULT_STOP_TIMEOUT);
    }

    public DirectoryWatcher(ChangeSourceFactory sourceFactory, Duration stopTimeout) {
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory");
        this.stopTimeout   = Objects.requireNonNull(stopTimeout, "stopTimeout");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Start watching {@code root} recursively.
     *
     * Returns once the loop thread is running and one priming invocation of
     * {@code callback} has completed on the calling thread. The priming call does
     * not set the change flag.
     *
     * @throws IllegalStateException if this watcher was already started
     */
    public synchronized void start(Path root, Runnable callback, Duration debounceInterval) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(debounceInterval, "debounceInterval");
        if (debounceInterval.isNegative()) {
            throw new IllegalArgumentException("Debounce interval must not be negative: " + debounceInterval);
        }
        if (started) {
            throw new IllegalStateException("Watcher already started for " + this.root);
        }
        started = true;
        this.root             = root;
        this.callback         = callback;
        this.debounceInterval = debounceInterval;

        ChangeSource acquired;
        try {
            acquired = sourceFactory.open(root);
        } catch (IOException | RuntimeException e) {
            log.warn("Cannot watch {} ({}); running in poll-only mode", root, e.getMessage());
            invokeCallback(false);
            return;
        }

        String name = String.valueOf(root.getFileName());
        ScheduledThreadPoolExecutor debounceTimer = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "watcher-debounce-" + name);
            t.setDaemon(true);
            return t;
        });
        debounceTimer.setRemoveOnCancelPolicy(true);
        debounceTimer.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        this.source  = acquired;
        this.timer   = debounceTimer;
        this.running = true;

        Thread thread = new Thread(() -> watchLoop(acquired), "watcher-" + name);
        thread.setDaemon(true);
        this.loopThread = thread;
        thread.start();
        log.info("Watching {} (debounce {} ms)", root, debounceInterval.toMillis());

        invokeCallback(false);
    }

    /**
     * Stop watching and release the change source.
     *
     * Interrupts the loop thread and closes the source, so a read blocked in the
     * platform call returns either way; then waits up to the stop timeout for the loop
     * to exit. A loop that outlives the timeout is logged, not thrown. Pending debounce
     * work is cancelled. Calling stop() again, or on a watcher that never got a source,
     * does nothing.
     */
    public void stop() {
        Thread                      thread;
        ChangeSource                src;
        ScheduledThreadPoolExecutor debounceTimer;
        synchronized (this) {
            if (source == null) {
                return;
            }
            running       = false;
            thread        = loopThread;
            src           = source;
            debounceTimer = timer;
            loopThread    = null;
            source        = null;
        }

        thread.interrupt();
        src.close();

        if (thread != Thread.currentThread()) {
            try {
                thread.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Watcher thread {} still alive {} ms after stop; it may leak",
                        thread.getName(), stopTimeout.toMillis());
            }
        }

        synchronized (timerLock) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        debounceTimer.shutdown();
        log.info("Stopped watching {}", root);
    }

    // ------------------------------------------------------------------
    // Change flag
    // ------------------------------------------------------------------

    /**
     * Returns true if a debounced refresh completed since the previous call, and clears
     * the flag. Two calls with no filesystem change in between return true, then false.
     */
    public boolean consumeChange() {
        return changed.getAndSet(false);
    }

    /** True while the loop thread owns a live change source. */
    public boolean isWatching() {
        return running;
    }

    // ------------------------------------------------------------------
    // Loop and debounce
    // ------------------------------------------------------------------

    private void watchLoop(ChangeSource src) {
        try {
            while (running) {
                int relevant;
                try {
                    relevant = src.awaitChanges();
                } catch (ChangeSourceClosedException e) {
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (IOException | RuntimeException e) {
                    if (!running) break;
                    log.warn("Error reading changes under {}, retrying: {}", root, e.getMessage());
                    if (!pause(RETRY_DELAY)) break;
                    continue;
                }
                if (relevant > 0 && running) {
                    log.trace("{} raw change(s) under {}", relevant, root);
                    scheduleRefresh();
                }
            }
        } finally {
            src.close();
            log.debug("Watch loop for {} exited", root);
        }
    }

    private void scheduleRefresh() {
        synchronized (timerLock) {
            if (pending != null) {
                pending.cancel(false);
            }
            long gen = ++generation;
            try {
                pending = timer.schedule(() -> fire(gen), debounceInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                // Timer already shut down by stop(); nothing left to refresh.
                pending = null;
            }
        }
    }

    private void fire(long gen) {
        synchronized (timerLock) {
            if (gen == generation) {
                pending = null;
            }
        }
        invokeCallback(true);
    }

    private void invokeCallback(boolean notify) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Watcher callback failed for {}", root, e);
        } finally {
            if (notify) {
                changed.set(true);
            }
        }
    }

    private static boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
