package com.gitagent.server.poll;

import com.gitagent.server.watch.DirectoryWatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PollCoordinatorTest {

    @Mock ChangeCache      cache;
    @Mock DirectoryWatcher watcher;

    SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
    }

    @Test
    void poll_consumesWatcherFlag_andPassesItToCache() {
        PollResult expected = new PollResult(true, false, "?? a.txt", true);
        when(watcher.consumeChange()).thenReturn(true);
        when(cache.poll(true, false)).thenReturn(expected);

        PollResult result = new PollCoordinator(cache, watcher, meters).poll(false);

        assertThat(result).isSameAs(expected);
        verify(watcher).consumeChange();
    }

    @Test
    void poll_forwardsForce() {
        when(watcher.consumeChange()).thenReturn(false);
        when(cache.poll(false, true)).thenReturn(new PollResult(true, false, "", false));

        new PollCoordinator(cache, watcher, meters).poll(true);

        verify(cache).poll(false, true);
    }

    @Test
    void poll_withoutWatcher_isNeverTriggered() {
        when(cache.poll(false, false)).thenReturn(new PollResult(false, false, "", false));

        new PollCoordinator(cache, null, meters).poll(false);

        verify(cache).poll(false, false);
    }

    @Test
    void poll_countsRequestsByOutcome() {
        when(watcher.consumeChange()).thenReturn(false);
        when(cache.poll(false, false)).thenReturn(
                new PollResult(true, true, "", false),
                new PollResult(false, false, "", false),
                new PollResult(false, false, "", false));
        PollCoordinator coordinator = new PollCoordinator(cache, watcher, meters);

        coordinator.poll(false);
        coordinator.poll(false);
        coordinator.poll(false);

        assertThat(meters.get("gitagent.poll.requests").tag("changed", "true").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("gitagent.poll.requests").tag("changed", "false").counter().count()).isEqualTo(2.0);
    }
}
