package com.gitagent.server.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the {@link ChangeSourceFactory} for a configured {@link WatchMode}.
 *
 * Platform selection happens here, once, when the factory is built; watcher code
 * never branches on the operating system.
 *
 * AUTO prefers the native source on macOS (FSEvents keeps one descriptor for the whole
 * tree) and the JDK WatchService elsewhere. If the preferred source cannot be opened
 * the timed re-scan is used instead, so AUTO only ends up poll-only when even the
 * re-scan fails.
 */
public final class ChangeSources {

    private static final Logger log = LoggerFactory.getLogger(ChangeSources.class);

    private ChangeSources() {}

    public static ChangeSourceFactory forMode(WatchMode mode, Set<String> ignoredDirs, Duration pollInterval) {
        return forMode(mode, ignoredDirs, pollInterval, osName());
    }

    /** Package-private so tests can select a platform without touching system properties. */
    static ChangeSourceFactory forMode(WatchMode mode, Set<String> ignoredDirs,
                                       Duration pollInterval, String os) {
        Set<String> ignored = Set.copyOf(ignoredDirs);
        return switch (mode) {
            case NATIVE   -> root -> NativeChangeSource.open(normalize(root), ignored);
            case JDK      -> root -> WatchServiceChangeSource.open(normalize(root), ignored);
            case POLLING  -> root -> new PollingChangeSource(normalize(root), ignored, pollInterval);
            case DISABLED -> root -> {
                throw new UnsupportedOperationException("Filesystem watching is disabled");
            };
            case AUTO     -> {
                WatchMode preferred = os.contains("mac") ? WatchMode.NATIVE : WatchMode.JDK;
                log.info("Watch mode AUTO resolved to {} for os '{}'", preferred, os);
                ChangeSourceFactory primary  = forMode(preferred, ignored, pollInterval, os);
                ChangeSourceFactory fallback = forMode(WatchMode.POLLING, ignored, pollInterval, os);
                yield root -> openWithFallback(root, primary, fallback);
            }
        };
    }

    private static ChangeSource openWithFallback(Path root,
                                                 ChangeSourceFactory primary,
                                                 ChangeSourceFactory fallback) throws IOException {
        try {
            return primary.open(root);
        } catch (IOException | RuntimeException e) {
            log.warn("Preferred change source unavailable for {}, falling back to polling: {}",
                    root, e.getMessage());
            return fallback.open(root);
        }
    }

    private static Path normalize(Path root) {
        return root.toAbsolutePath().normalize();
    }

    static String osName() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    }
}
