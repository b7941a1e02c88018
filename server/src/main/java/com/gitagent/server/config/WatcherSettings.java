package com.gitagent.server.config;

import com.gitagent.server.watch.WatchMode;

import java.time.Duration;
import java.util.Set;

/**
 * Everything a repository session needs to know to watch and scan a working tree.
 *
 * @param mode              change source selection
 * @param debounce          quiet period before a burst of events triggers a refresh
 * @param stopTimeout       how long stopping a watcher waits for its loop thread
 * @param pollInterval      re-scan period of the polling change source
 * @param ignoredDirs       directory names excluded from watching and file listing
 * @param gitCommandTimeout upper bound for a single git invocation
 */
public record WatcherSettings(WatchMode mode,
                              Duration debounce,
                              Duration stopTimeout,
                              Duration pollInterval,
                              Set<String> ignoredDirs,
                              Duration gitCommandTimeout) {

    public static final Set<String> DEFAULT_IGNORED_DIRS =
            Set.of(".git", "__pycache__", "node_modules", "venv", ".idea", ".vscode");

    public WatcherSettings {
        ignoredDirs = Set.copyOf(ignoredDirs);
    }
}
