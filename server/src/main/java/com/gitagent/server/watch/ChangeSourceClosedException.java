package com.gitagent.server.watch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown by {@link ChangeSource#awaitChanges()} after the source has been closed.
 * The watcher loop treats it as the normal cancellation path, not as an error.
 */
public class ChangeSourceClosedException extends IOException {

    public ChangeSourceClosedException(Path root) {
        super("Change source for " + root + " is closed");
    }

    public ChangeSourceClosedException(Path root, Throwable cause) {
        super("Change source for " + root + " is closed", cause);
    }
}
