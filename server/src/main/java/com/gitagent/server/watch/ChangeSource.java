package com.gitagent.server.watch;

import java.io.Closeable;
import java.io.IOException;

/**
 * One subscription to filesystem change notifications for a directory tree.
 *
 * A source is owned by exactly one {@link DirectoryWatcher}: only its loop thread calls
 * {@link #awaitChanges()}, and only the loop thread or the thread running
 * {@link DirectoryWatcher#stop()} calls {@link #close()}.
 *
 * Implementations are picked by {@link ChangeSources} when the watcher is started:
 * <ul>
 *   <li>{@link NativeChangeSource}        : platform-native recursive watching</li>
 *   <li>{@link WatchServiceChangeSource}  : JDK WatchService, one key per directory</li>
 *   <li>{@link PollingChangeSource}       : timed re-scan where neither is available</li>
 * </ul>
 */
public interface ChangeSource extends Closeable {

    /**
     * Block until at least one batch of raw events arrives.
     *
     * @return number of events in the batch that fall outside the ignored directories;
     *         zero means the batch was noise and no refresh is needed
     * @throws ChangeSourceClosedException once {@link #close()} has been called, including
     *         when close() is what woke the blocked call
     * @throws InterruptedException if the calling thread is interrupted while blocked
     * @throws IOException on a read failure the caller may retry
     */
    int awaitChanges() throws IOException, InterruptedException;

    /** Release the underlying OS resource. Idempotent; never throws. */
    @Override
    void close();
}
