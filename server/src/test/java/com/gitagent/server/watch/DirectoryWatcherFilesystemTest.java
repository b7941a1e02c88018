package com.gitagent.server.watch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.gitagent.server.watch.DirectoryWatcherTest.awaitTrue;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end watcher tests on a real temporary directory, using the JDK WatchService
 * source (available on every platform the build runs on).
 */
class DirectoryWatcherFilesystemTest {

    @TempDir Path root;

    final AtomicInteger refreshes = new AtomicInteger();
    DirectoryWatcher watcher;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve(".git"));
        Files.createDirectories(root.resolve("src"));
        watcher = new DirectoryWatcher(
                ChangeSources.forMode(WatchMode.JDK, Set.of(".git"), Duration.ofMillis(100)));
        watcher.start(root, refreshes::incrementAndGet, Duration.ofMillis(100));
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
    }

    @Test
    void newFile_setsFlagAfterRefresh() throws Exception {
        Files.writeString(root.resolve("new.txt"), "hello");

        assertThat(awaitTrue(watcher::consumeChange)).isTrue();
        assertThat(refreshes.get()).isGreaterThanOrEqualTo(2);

        Thread.sleep(400);
        assertThat(watcher.consumeChange()).isFalse();
    }

    @Test
    void fileInSubdirectory_isSeen() throws Exception {
        Files.writeString(root.resolve("src").resolve("Main.java"), "class Main {}");

        assertThat(awaitTrue(watcher::consumeChange)).isTrue();
    }

    @Test
    void directoryCreatedAfterStart_isWatchedToo() throws Exception {
        Path pkg = Files.createDirectories(root.resolve("lib"));
        assertThat(awaitTrue(watcher::consumeChange)).isTrue();

        Files.writeString(pkg.resolve("util.txt"), "x");

        assertThat(awaitTrue(watcher::consumeChange)).isTrue();
    }

    @Test
    void changesInsideIgnoredDirectory_doNotSetFlag() throws Exception {
        Files.writeString(root.resolve(".git").resolve("index.lock"), "lock");
        Files.delete(root.resolve(".git").resolve("index.lock"));

        Thread.sleep(600);

        assertThat(watcher.consumeChange()).isFalse();
        assertThat(refreshes.get()).isEqualTo(1);
    }
}
