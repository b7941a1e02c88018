package com.gitagent.server.watch;

import java.util.Locale;

/**
 * Which {@link ChangeSource} implementation a watcher uses.
 *
 * AUTO     : native on macOS, JDK WatchService elsewhere; falls back to POLLING
 * NATIVE   : io.methvin directory-watcher (FSEvents / inotify / FILE_TREE)
 * JDK      : java.nio.file.WatchService with per-directory registration
 * POLLING  : periodic fingerprint re-scan
 * DISABLED : never acquire a source; the watcher runs in poll-only mode
 */
public enum WatchMode {
    AUTO,
    NATIVE,
    JDK,
    POLLING,
    DISABLED;

    /** Case-insensitive lookup used for the {@code gitagent.watcher.mode} property. */
    public static WatchMode parse(String value) {
        if (value == null || value.isBlank()) return AUTO;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown watch mode '" + value
                    + "' (expected auto, native, jdk, polling or disabled)", e);
        }
    }
}
