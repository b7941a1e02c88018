package com.gitagent.server.git;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs the real git binary in a temporary repository. Skipped where git is not installed.
 */
class GitOperationsIntegrationTest {

    @TempDir Path root;

    GitClient     git;
    GitOperations ops;

    @BeforeEach
    void setUp() {
        git = new GitClient(root, Duration.ofSeconds(30));
        assumeTrue(gitAvailable(git), "git executable not available");
        git.run("init");
        git.run("symbolic-ref", "HEAD", "refs/heads/main");
        git.run("config", "user.email", "dev@example.com");
        git.run("config", "user.name", "Dev");
        git.run("config", "commit.gpgsign", "false");
        ops = new GitOperations(git);
    }

    @Test
    void statusScanner_listsUntrackedFilesIndividually() throws Exception {
        Files.createDirectories(root.resolve("dir"));
        Files.writeString(root.resolve("dir").resolve("a.txt"), "a");

        Optional<String> status = new GitStatusScanner(git).scan();

        assertThat(status).isPresent();
        assertThat(status.get()).contains("?? dir/a.txt");
    }

    @Test
    void commitAll_thenCountsAndLog() throws Exception {
        Files.writeString(root.resolve("README.md"), "# demo");

        ops.commitAll("Initial commit");

        assertThat(ops.log(10)).contains("Initial commit");
        assertThat(ops.commitCounts().total()).isEqualTo(1);
        assertThat(ops.commitCounts().unpushed()).isEqualTo(1);   // no upstream
        assertThat(ops.currentBranch()).isEqualTo("main");
        assertThat(ops.shortStatus()).isEmpty();
    }

    @Test
    void revert_modifiedTrackedFile_restoresCommittedContent() throws Exception {
        Path readme = root.resolve("README.md");
        Files.writeString(readme, "original");
        ops.commitAll("Initial commit");
        Files.writeString(readme, "edited");

        assertThat(ops.diff("README.md")).contains("-original").contains("+edited");
        ops.revert("README.md");

        assertThat(Files.readString(readme)).isEqualTo("original");
    }

    @Test
    void createAndSwitchBranches() throws Exception {
        Files.writeString(root.resolve("a.txt"), "a");
        ops.commitAll("first");

        ops.createBranch("feature", true);
        assertThat(ops.currentBranch()).isEqualTo("feature");

        ops.switchBranch("main");
        assertThat(ops.branches().local()).containsExactly("main", "feature");
    }

    @Test
    void undoLastCommit_keepsChangesStaged() throws Exception {
        Files.writeString(root.resolve("a.txt"), "a");
        ops.commitAll("first");
        Files.writeString(root.resolve("b.txt"), "b");
        ops.commitAll("second");

        ops.undoLastCommit();

        assertThat(ops.commitCounts().total()).isEqualTo(1);
        assertThat(ops.shortStatus()).contains("A  b.txt");
    }

    @Test
    void statusScanner_outsideRepository_isUnavailable(@TempDir Path plain) {
        GitClient outside = new GitClient(plain, Duration.ofSeconds(30));
        // A plain temp dir may still sit inside a repository on some build machines,
        // so only assert when git itself agrees this is not a work tree.
        boolean insideWorkTree = outside.exec("rev-parse", "--is-inside-work-tree").succeeded();
        assumeTrue(!insideWorkTree);

        assertThat(new GitStatusScanner(outside).scan()).isEmpty();
    }

    static boolean gitAvailable(GitClient client) {
        try {
            return client.exec("--version").succeeded();
        } catch (GitCommandException e) {
            return false;
        }
    }
}
