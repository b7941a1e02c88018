package com.gitagent.server.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The git operations offered to the UI and to scripts, built on one {@link GitClient}.
 *
 * Methods return git's trimmed output for display and throw {@link GitCommandException}
 * when git refuses.
 */
public class GitOperations {

    private static final Logger log = LoggerFactory.getLogger(GitOperations.class);

    private static final Pattern AHEAD  = Pattern.compile("ahead (\\d+)");
    private static final Pattern BEHIND = Pattern.compile("behind (\\d+)");

    // -------------------------------------------------------------------------
    // Result records
    // -------------------------------------------------------------------------

    public record CommitCounts(int total, int unpushed, int behind) {
        public static final CommitCounts NONE = new CommitCounts(0, 0, 0);
    }

    /** @param local current branch first; @param remote names not already local */
    public record Branches(List<String> local, List<String> remote, String current) {}

    public record BranchChange(String output, String branch) {}

    private final GitClient git;

    public GitOperations(GitClient git) {
        this.git = git;
    }

    public GitClient client() {
        return git;
    }

    // -------------------------------------------------------------------------
    // Repository-wide operations
    // -------------------------------------------------------------------------

    /** {@code git status -s -u}, the short listing shown to people. */
    public String shortStatus() {
        return git.run("status", "-s", "-u").output();
    }

    /** Name of the directory at the top of the working tree. */
    public String repositoryName() {
        String top = git.run("rev-parse", "--show-toplevel").output();
        Path name = Path.of(top).getFileName();
        return name != null ? name.toString() : top;
    }

    /** Stage everything, then commit. */
    public String commitAll(String message) {
        git.run("add", ".");
        return git.run("commit", "-m", message).output();
    }

    public String push() {
        return git.run("push").output();
    }

    public String pull() {
        return git.run("pull").output();
    }

    /** Drop the last commit but keep its changes staged. */
    public String undoLastCommit() {
        return git.run("reset", "--soft", "HEAD~1").output();
    }

    public String log(int limit) {
        return git.run("log", "--oneline", "-n", String.valueOf(limit)).output();
    }

    /**
     * Total commits on HEAD plus ahead/behind counts against the upstream. Without an
     * upstream every commit counts as unpushed. A repository with no commits yields zeros.
     */
    public CommitCounts commitCounts() {
        CommandResult count = git.exec("rev-list", "--count", "HEAD");
        if (!count.succeeded()) {
            return CommitCounts.NONE;
        }
        int total;
        try {
            total = Integer.parseInt(count.output());
        } catch (NumberFormatException e) {
            throw new GitCommandException("Could not parse commit count: " + count.output());
        }

        String header = git.run("status", "-sb").output().lines().findFirst().orElse("");
        if (!header.contains("...")) {
            return new CommitCounts(total, total, 0);
        }
        return new CommitCounts(total, firstNumber(AHEAD, header), firstNumber(BEHIND, header));
    }

    // -------------------------------------------------------------------------
    // Branches
    // -------------------------------------------------------------------------

    public String currentBranch() {
        return git.run("branch", "--show-current").output();
    }

    public Branches branches() {
        String current = currentBranch();
        List<String> local = localBranches();
        if (local.remove(current)) {
            local.add(0, current);
        }

        List<String> remote = new ArrayList<>();
        for (String line : git.run("branch", "-r").stdout().split("\n")) {
            String entry = line.strip();
            if (entry.isEmpty() || entry.contains("HEAD")) {
                continue;
            }
            String name = entry.substring(entry.lastIndexOf('/') + 1).strip();
            if (!name.isEmpty() && !local.contains(name) && !remote.contains(name)) {
                remote.add(name);
            }
        }
        return new Branches(local, remote, current);
    }

    /**
     * Check out a local branch, or create a tracking branch from {@code origin/<name>}.
     *
     * @throws BranchNotFoundException if neither exists
     */
    public BranchChange switchBranch(String name) {
        String output;
        if (localBranches().contains(name)) {
            output = git.run("checkout", name).combinedOutput();
        } else if (remoteExists(name)) {
            output = git.run("checkout", "-b", name, "origin/" + name).combinedOutput();
        } else {
            throw new BranchNotFoundException(name);
        }
        String now = currentBranch();
        return new BranchChange(output, now.isEmpty() ? name : now);
    }

    /**
     * @throws IllegalArgumentException if a local branch of that name already exists
     */
    public BranchChange createBranch(String name, boolean switchTo) {
        if (localBranches().contains(name)) {
            throw new IllegalArgumentException("Branch '" + name + "' already exists");
        }
        String output = switchTo
                ? git.run("checkout", "-b", name).combinedOutput()
                : git.run("branch", name).combinedOutput();
        String now = currentBranch();
        return new BranchChange(output, now.isEmpty() ? name : now);
    }

    // -------------------------------------------------------------------------
    // Single-path operations
    // -------------------------------------------------------------------------

    public String stage(String path) {
        return git.run("add", "--", path).output();
    }

    public String unstage(String path) {
        return git.run("reset", "HEAD", "--", path).output();
    }

    /**
     * Discard every change to one path. Untracked and newly added files are deleted;
     * tracked files are unstaged and restored from HEAD.
     *
     * @return a message describing what was done
     * @throws NoSuchFileException if a file that has to be deleted is already gone
     */
    public String revert(String path) throws IOException {
        Path file = git.workDir().resolve(path);

        switch (classify(path)) {
            case UNTRACKED -> {
                deleteExisting(file);
                return "Removed untracked file '" + path + "'";
            }
            case ADDED -> {
                git.exec("reset", "HEAD", "--", path);
                deleteExisting(file);
                return "Removed new file '" + path + "'";
            }
            default -> {
                git.exec("reset", "HEAD", "--", path);
                CommandResult checkout = git.exec("checkout", "HEAD", "--", path);
                if (checkout.succeeded()) {
                    return "Reverted '" + path + "' to HEAD version";
                }
                CommandResult inHead = git.exec("ls-tree", "HEAD", "--", path);
                if (inHead.succeeded() && !inHead.output().isEmpty()) {
                    throw new GitCommandException("Failed to revert file '" + path + "': "
                            + checkout.stderr().strip(), checkout.exitCode());
                }
                deleteExisting(file);
                return "Removed new file '" + path + "'";
            }
        }
    }

    /** Diff of one path against HEAD; "" when git cannot produce one (e.g. untracked). */
    public String diff(String path) {
        CommandResult result = git.exec("diff", "HEAD", "--", path);
        if (!result.succeeded()) {
            log.debug("No diff for {}: {}", path, result.stderr().strip());
            return "";
        }
        return result.output();
    }

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    private enum PathState { UNTRACKED, ADDED, TRACKED }

    private PathState classify(String path) {
        String porcelain = git.run("status", "--porcelain", "-u").stdout();
        for (String line : porcelain.split("\n")) {
            if (line.length() < 4) {
                continue;
            }
            String listed = line.substring(3);
            if (listed.length() > 1 && listed.startsWith("\"") && listed.endsWith("\"")) {
                listed = listed.substring(1, listed.length() - 1);
            }
            if (!listed.equals(path)) {
                continue;
            }
            String code = line.substring(0, 2);
            if (code.equals("??")) {
                return PathState.UNTRACKED;
            }
            if (code.charAt(0) == 'A' || code.charAt(1) == 'A') {
                return PathState.ADDED;
            }
            return PathState.TRACKED;
        }
        return PathState.TRACKED;
    }

    private List<String> localBranches() {
        List<String> names = new ArrayList<>();
        for (String line : git.run("branch").stdout().split("\n")) {
            String name = line.replace("*", "").strip();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private boolean remoteExists(String name) {
        return git.run("branch", "-r").stdout().lines()
                .map(String::strip)
                .anyMatch(line -> line.equals("origin/" + name) || line.endsWith("/" + name));
    }

    private static void deleteExisting(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "File not found");
        }
        Files.delete(file);
    }

    private static int firstNumber(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }
}
