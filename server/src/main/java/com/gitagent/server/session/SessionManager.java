package com.gitagent.server.session;

import com.gitagent.server.config.WatcherSettings;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Holds the one active {@link RepositorySession}.
 *
 * Selecting a new working tree closes the previous session completely (its watcher thread
 * is stopped) before the new one starts, so two watchers never feed the API at once.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final WatcherSettings settings;
    private final MeterRegistry   meterRegistry;

    private volatile RepositorySession current;

    public SessionManager(WatcherSettings settings, MeterRegistry meterRegistry) {
        this.settings      = settings;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Make {@code path} the active working tree.
     *
     * @throws IllegalArgumentException if the path is blank, malformed, or not an existing directory
     */
    public synchronized RepositorySession select(String path) {
        Path root = validate(path);

        RepositorySession previous = current;
        current = null;
        if (previous != null) {
            previous.close();
        }

        current = RepositorySession.open(root, settings, meterRegistry);
        log.info("Repository set to {}", root);
        return current;
    }

    public Optional<RepositorySession> current() {
        return Optional.ofNullable(current);
    }

    /**
     * @throws NoActiveSessionException if no working tree has been selected
     */
    public RepositorySession require() {
        RepositorySession session = current;
        if (session == null) {
            throw new NoActiveSessionException();
        }
        return session;
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (current != null) {
            current.close();
            current = null;
        }
    }

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    private static Path validate(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Invalid path");
        }
        Path root;
        try {
            root = Path.of(path).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path");
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Invalid path");
        }
        return root;
    }
}
