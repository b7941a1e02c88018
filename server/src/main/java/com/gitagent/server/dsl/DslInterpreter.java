package com.gitagent.server.dsl;

import com.gitagent.server.git.CommandResult;
import com.gitagent.server.git.GitCommandException;
import com.gitagent.server.git.GitOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;

/**
 * Runs the small line-oriented git scripting language the assistant proposes.
 *
 * <pre>
 *   # comments and blank lines are skipped
 *   repo                  print repository name and root
 *   status                list changes and their count
 *   commit "message"      stage everything and commit
 *   push ["message"]      optionally commit first, then push
 *   pull
 *   undo                  soft-reset the last commit
 *   deploy "command"      run a shell command
 *   cd path               move to another directory for the following lines
 *   log [n]               last n commits, default 10
 * </pre>
 *
 * A failing line is reported in the transcript and execution moves on to the next line.
 * One interpreter runs one script; {@code cd} only affects the rest of that script.
 */
public class DslInterpreter {

    private static final Logger log = LoggerFactory.getLogger(DslInterpreter.class);

    static final int DEFAULT_LOG_LIMIT = 10;

    private final Function<Path, GitOperations> relocate;
    private GitOperations ops;
    private StringBuilder out;

    public DslInterpreter(GitOperations ops) {
        this(ops, dir -> new GitOperations(ops.client().withWorkDir(dir)));
    }

    DslInterpreter(GitOperations ops, Function<Path, GitOperations> relocate) {
        this.ops      = ops;
        this.relocate = relocate;
    }

    /** Execute every line of {@code script} and return the transcript. */
    public String execute(String script) {
        out = new StringBuilder();
        println("Executing DSL script");

        String[] lines = script.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            println("");
            println("[Line " + (i + 1) + "] Executing: " + line);
            log.info("Script line {}: {}", i + 1, line);
            try {
                executeLine(line);
            } catch (GitCommandException e) {
                log.warn("Script line {} failed: {}", i + 1, e.getMessage());
                println("Error: " + e.getMessage());
            }
        }
        return out.toString();
    }

    // -------------------------------------------------------------------------
    // Commands
    // -------------------------------------------------------------------------

    private void executeLine(String line) {
        String[] parts   = line.split(" ", 2);
        String   command = parts[0].toLowerCase(Locale.ROOT);
        String   arg     = parts.length > 1 ? unquote(parts[1]) : null;

        switch (command) {
            case "repo"   -> repo();
            case "status" -> status();
            case "push"   -> push(arg);
            case "commit" -> {
                if (arg == null) println("Error: 'commit' requires a message.");
                else commit(arg);
            }
            case "pull"   -> {
                println("Pulling latest changes...");
                ops.pull();
                println("Successfully pulled changes.");
            }
            case "undo"   -> {
                println("Undoing last commit (keeping changes staged)...");
                ops.undoLastCommit();
                println("Successfully undid last commit.");
            }
            case "deploy" -> {
                if (arg == null) println("Error: 'deploy' requires a command.");
                else deploy(arg);
            }
            case "cd"     -> {
                if (arg == null) println("Error: 'cd' requires a path.");
                else changeDirectory(arg);
            }
            case "log"    -> {
                int limit = logLimit(arg);
                println("Getting last " + limit + " commits...");
                String history = ops.log(limit);
                if (!history.isEmpty()) println(history);
            }
            default       -> println("Error: Unknown command '" + command + "'");
        }
    }

    private void repo() {
        Path root = ops.client().workDir();
        try {
            println("Current Repository: " + ops.repositoryName() + " (" + root + ")");
        } catch (GitCommandException e) {
            println("Not currently in a git repository.");
        }
    }

    private void status() {
        String listing = ops.shortStatus();
        if (listing.isEmpty()) {
            println("No changes found.");
            return;
        }
        String[] changes = listing.split("\n");
        println("Number of changes: " + changes.length);
        println("Changes:");
        for (String change : changes) {
            println("  " + change);
        }
    }

    private void commit(String message) {
        println("Staging all changes...");
        println("Committing with message: '" + message + "'...");
        ops.commitAll(message);
        println("Successfully committed changes.");
    }

    private void push(String message) {
        if (message != null) {
            try {
                commit(message);
            } catch (GitCommandException e) {
                // "nothing to commit" is common here; the push still goes ahead
                println("Error: " + e.getMessage());
            }
        }
        println("Pushing to remote...");
        ops.push();
        println("Successfully pushed changes.");
    }

    private void deploy(String commandLine) {
        println("Deploying with command: " + commandLine + "...");
        CommandResult result = ops.client().shell(commandLine);
        if (!result.output().isEmpty()) println(result.output());
        if (result.succeeded()) {
            println("Deployment successful.");
        } else {
            println("Error: deploy exited with status " + result.exitCode());
            if (!result.stderr().isBlank()) println(result.stderr().strip());
        }
    }

    private void changeDirectory(String target) {
        Path dir = ops.client().workDir().resolve(target).normalize();
        if (!Files.isDirectory(dir)) {
            println("Error: Directory '" + target + "' does not exist.");
            return;
        }
        ops = relocate.apply(dir);
        println("Changed directory to: " + dir);
    }

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    static String unquote(String raw) {
        String s = raw.strip();
        while (s.startsWith("\"") || s.startsWith("'")) s = s.substring(1);
        while (s.endsWith("\"") || s.endsWith("'")) s = s.substring(0, s.length() - 1);
        return s.isEmpty() ? null : s;
    }

    /** Positive count from the argument; anything else, including overflow, gives the default. */
    static int logLimit(String arg) {
        if (arg == null || arg.isEmpty() || !arg.chars().allMatch(Character::isDigit)) {
            return DEFAULT_LOG_LIMIT;
        }
        try {
            int limit = Integer.parseInt(arg);
            return limit > 0 ? limit : DEFAULT_LOG_LIMIT;
        } catch (NumberFormatException e) {
            return DEFAULT_LOG_LIMIT;
        }
    }

    private void println(String line) {
        out.append(line).append('\n');
    }
}
