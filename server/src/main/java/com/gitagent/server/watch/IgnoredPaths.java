package com.gitagent.server.watch;

import java.nio.file.Path;
import java.util.Set;

/** Decides whether a changed path lies inside one of the ignored directory names. */
final class IgnoredPaths {

    private IgnoredPaths() {}

    /**
     * True if any name element of {@code path} below {@code root} is in {@code ignoredDirs}.
     * Paths that do not resolve under the root (symlinked temp dirs on macOS report
     * /private/var/...) are never ignored.
     */
    static boolean isIgnored(Path root, Path path, Set<String> ignoredDirs) {
        if (!path.startsWith(root)) return false;
        Path relative = root.relativize(path);
        for (Path element : relative) {
            if (ignoredDirs.contains(element.toString())) {
                return true;
            }
        }
        return false;
    }
}
