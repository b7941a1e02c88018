package com.gitagent.server.watch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Acquires a {@link ChangeSource} for a directory tree.
 *
 * Any exception thrown here is a resource-unavailable failure: the watcher logs it and
 * drops to poll-only mode instead of failing the session.
 */
@FunctionalInterface
public interface ChangeSourceFactory {

    ChangeSource open(Path root) throws IOException;
}
