package com.gitagent.server.watch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the directory-watcher backed source on a real temporary directory.
 */
class NativeChangeSourceTest {

    @TempDir Path root;

    final ExecutorService reader = Executors.newSingleThreadExecutor();
    NativeChangeSource source;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve(".git"));
        source = NativeChangeSource.open(root, Set.of(".git"));
    }

    @AfterEach
    void tearDown() {
        source.close();
        reader.shutdownNow();
    }

    @Test
    void newFile_isReported() throws Exception {
        Future<Integer> changes = reader.submit(source::awaitChanges);

        Files.writeString(root.resolve("new.txt"), "hello");

        assertThat(changes.get(5, TimeUnit.SECONDS)).isPositive();
    }

    @Test
    void writeUnderIgnoredDirectory_isNotReported() throws Exception {
        Future<Integer> changes = reader.submit(source::awaitChanges);

        Files.writeString(root.resolve(".git").resolve("index.lock"), "lock");

        assertThatThrownBy(() -> changes.get(600, TimeUnit.MILLISECONDS))
                .isInstanceOf(TimeoutException.class);
    }

    @Test
    void close_unblocksPendingRead_withClosedException() throws Exception {
        Future<Integer> changes = reader.submit(source::awaitChanges);
        Thread.sleep(100);

        source.close();

        assertThatThrownBy(() -> changes.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ChangeSourceClosedException.class);
        assertThatThrownBy(source::awaitChanges).isInstanceOf(ChangeSourceClosedException.class);
    }

    // ------------------------------------------------------------------
    // Acquisition failure
    // ------------------------------------------------------------------

    @Test
    void open_missingRoot_throws() {
        Path missing = root.resolve("gone");

        assertThatThrownBy(() -> NativeChangeSource.open(missing, Set.of()))
                .isInstanceOf(IOException.class);
    }

    @Test
    void autoModeOnMac_missingRoot_doesNotHandOutNativeSource() {
        ChangeSourceFactory factory = ChangeSources.forMode(
                WatchMode.AUTO, Set.of(), Duration.ofMillis(100), "mac os x");

        assertThatThrownBy(() -> factory.open(root.resolve("gone"))).isInstanceOf(IOException.class);
    }

    @Test
    void watcher_missingRootInNativeMode_runsPollOnly() {
        DirectoryWatcher watcher = new DirectoryWatcher(
                ChangeSources.forMode(WatchMode.NATIVE, Set.of(), Duration.ofMillis(100)));
        int[] refreshes = {0};
        try {
            watcher.start(root.resolve("gone"), () -> refreshes[0]++, Duration.ofMillis(100));

            assertThat(watcher.isWatching()).isFalse();
            assertThat(refreshes[0]).isEqualTo(1);
        } finally {
            watcher.stop();
        }
    }
}
