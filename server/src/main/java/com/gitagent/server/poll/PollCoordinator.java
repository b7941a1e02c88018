package com.gitagent.server.poll;

import com.gitagent.server.watch.DirectoryWatcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the poll protocol: consumes the watcher's change flag and hands the
 * decision to the {@link ChangeCache}.
 *
 * The flag is set only after a refresh has finished, so a true flag means the cache
 * already holds the post-change snapshot.
 */
public class PollCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PollCoordinator.class);

    private final ChangeCache      cache;
    private final DirectoryWatcher watcher;       // null when the session has no watcher
    private final MeterRegistry    meterRegistry;

    public PollCoordinator(ChangeCache cache, DirectoryWatcher watcher, MeterRegistry meterRegistry) {
        this.cache         = cache;
        this.watcher       = watcher;
        this.meterRegistry = meterRegistry;
    }

    public PollResult poll(boolean force) {
        boolean watcherTriggered = watcher != null && watcher.consumeChange();
        PollResult result = cache.poll(watcherTriggered, force);

        meterRegistry.counter("gitagent.poll.requests",
                "changed", String.valueOf(result.hasChanged())).increment();
        log.debug("Poll force={} watcherTriggered={} -> hasChanged={} filesChanged={} analyze={}",
                force, watcherTriggered, result.hasChanged(), result.filesChanged(), result.analyze());
        return result;
    }
}
