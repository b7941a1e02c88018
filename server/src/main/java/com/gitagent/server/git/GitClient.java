package com.gitagent.server.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the git executable (and, for deploy steps, the platform shell) in one directory.
 *
 * Arguments are passed straight to the process, never through a shell, so paths and
 * commit messages need no quoting. Prompts for credentials are disabled so a push that
 * would ask for a password fails instead of hanging until the timeout.
 */
public class GitClient {

    private static final Logger log = LoggerFactory.getLogger(GitClient.class);

    // stdout and stderr are drained concurrently so a chatty command cannot fill a pipe
    // buffer and deadlock against waitFor().
    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "git-stream-reader");
        t.setDaemon(true);
        return t;
    });

    private final Path     workDir;
    private final Duration timeout;

    public GitClient(Path workDir, Duration timeout) {
        this.workDir = workDir;
        this.timeout = timeout;
    }

    public Path workDir() {
        return workDir;
    }

    /** Same timeout, different directory. Used by the DSL's {@code cd}. */
    public GitClient withWorkDir(Path dir) {
        return new GitClient(dir, timeout);
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Run {@code git <args>} and require exit status 0.
     *
     * @throws GitCommandException on non-zero exit, timeout, or start failure;
     *                             the message carries git's stderr
     */
    public CommandResult run(String... args) {
        CommandResult result = exec(args);
        if (!result.succeeded()) {
            String detail = result.stderr().isBlank() ? result.stdout().strip() : result.stderr().strip();
            throw new GitCommandException(
                    "git %s failed: %s".formatted(String.join(" ", args), detail), result.exitCode());
        }
        return result;
    }

    /** Run {@code git <args>} and return whatever happened, whatever the exit status. */
    public CommandResult exec(String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(Arrays.asList(args));
        return execute(command);
    }

    /**
     * Run a command line through the platform shell ({@code sh -c} or {@code cmd /c}).
     * Only the DSL's deploy step uses this.
     */
    public CommandResult shell(String commandLine) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        List<String> command = windows
                ? List.of("cmd", "/c", commandLine)
                : List.of("sh", "-c", commandLine);
        return execute(command);
    }

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    private CommandResult execute(List<String> command) {
        log.debug("Running {} in {}", command, workDir);
        ProcessBuilder builder = new ProcessBuilder(command).directory(workDir.toFile());
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new GitCommandException("Could not start " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = readAsync(process.getErrorStream());
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GitCommandException(
                        "%s timed out after %ds".formatted(String.join(" ", command), timeout.toSeconds()));
            }
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted while running " + command, e);
        } catch (ExecutionException e) {
            throw new GitCommandException("Could not read output of " + command, e.getCause());
        }
    }

    private static CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new GitCommandException("Stream read failed", e);
            }
        }, STREAM_READERS);
    }
}
