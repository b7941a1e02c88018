package com.gitagent.server.dsl;

import com.gitagent.server.git.CommandResult;
import com.gitagent.server.git.GitClient;
import com.gitagent.server.git.GitCommandException;
import com.gitagent.server.git.GitOperations;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DslInterpreterTest {

    @Mock GitOperations ops;
    @Mock GitClient     client;

    @Test
    void execute_commitLine_commitsAndNumbersLines() {
        String out = new DslInterpreter(ops).execute("# prepare\n\ncommit \"Fix login\"\n");

        verify(ops).commitAll("Fix login");
        assertThat(out)
                .contains("[Line 3] Executing: commit \"Fix login\"")
                .contains("Committing with message: 'Fix login'...")
                .contains("Successfully committed changes.")
                .doesNotContain("[Line 1]");
    }

    @Test
    void execute_commandsAreCaseInsensitive() {
        new DslInterpreter(ops).execute("PULL");

        verify(ops).pull();
    }

    @Test
    void execute_pushWithMessage_commitsFirst() {
        String out = new DslInterpreter(ops).execute("push 'Ship it'");

        var order = inOrder(ops);
        order.verify(ops).commitAll("Ship it");
        order.verify(ops).push();
        assertThat(out).contains("Successfully pushed changes.");
    }

    @Test
    void execute_failingLine_isReportedAndLaterLinesStillRun() {
        when(ops.pull()).thenThrow(new GitCommandException("git pull failed: no remote"));

        String out = new DslInterpreter(ops).execute("pull\nundo");

        assertThat(out).contains("Error: git pull failed: no remote");
        verify(ops).undoLastCommit();
        assertThat(out).contains("Successfully undid last commit.");
    }

    @Test
    void execute_missingArguments_andUnknownCommands_reportErrors() {
        String out = new DslInterpreter(ops).execute("commit\ndeploy\ncd\nfrobnicate now");

        assertThat(out)
                .contains("Error: 'commit' requires a message.")
                .contains("Error: 'deploy' requires a command.")
                .contains("Error: 'cd' requires a path.")
                .contains("Error: Unknown command 'frobnicate'");
        verifyNoInteractions(ops);
    }

    @Test
    void execute_log_defaultsToTenAndAcceptsLimit() {
        when(ops.log(10)).thenReturn("abc123 first");
        when(ops.log(3)).thenReturn("abc123 first");

        String out = new DslInterpreter(ops).execute("log\nlog 3\nlog many");

        verify(ops, times(2)).log(10);
        verify(ops).log(3);
        assertThat(out).contains("Getting last 3 commits...").contains("abc123 first");
    }

    @Test
    void execute_logCountTooLargeForInt_usesDefaultAndKeepsGoing() {
        when(ops.log(10)).thenReturn("abc123 first");

        String out = new DslInterpreter(ops).execute("log 99999999999\npull");

        verify(ops).log(10);
        verify(ops).pull();
        assertThat(out)
                .contains("Getting last 10 commits...")
                .contains("[Line 2] Executing: pull");
    }

    @Test
    void logLimit_rejectsZeroAndNonDigits() {
        assertThat(DslInterpreter.logLimit("0")).isEqualTo(DslInterpreter.DEFAULT_LOG_LIMIT);
        assertThat(DslInterpreter.logLimit("-5")).isEqualTo(DslInterpreter.DEFAULT_LOG_LIMIT);
        assertThat(DslInterpreter.logLimit("25")).isEqualTo(25);
    }

    @Test
    void execute_status_countsChanges() {
        when(ops.shortStatus()).thenReturn(" M a.txt\n?? b.txt");

        String out = new DslInterpreter(ops).execute("status");

        assertThat(out).contains("Number of changes: 2").contains("   M a.txt").contains("  ?? b.txt");
    }

    @Test
    void execute_status_cleanTree() {
        when(ops.shortStatus()).thenReturn("");

        assertThat(new DslInterpreter(ops).execute("status")).contains("No changes found.");
    }

    @Test
    void execute_deploy_runsShellCommand() {
        when(ops.client()).thenReturn(client);
        when(client.shell("make deploy")).thenReturn(new CommandResult(0, "deployed\n", ""));

        String out = new DslInterpreter(ops).execute("deploy \"make deploy\"");

        assertThat(out).contains("Deploying with command: make deploy...")
                .contains("deployed")
                .contains("Deployment successful.");
    }

    @Test
    void execute_cd_switchesOperationsForFollowingLines(@TempDir Path root) throws Exception {
        Files.createDirectories(root.resolve("other"));
        GitOperations otherOps = mock(GitOperations.class);
        when(ops.client()).thenReturn(client);
        when(client.workDir()).thenReturn(root);

        DslInterpreter interpreter = new DslInterpreter(ops, dir -> {
            assertThat(dir).isEqualTo(root.resolve("other"));
            return otherOps;
        });
        String out = interpreter.execute("cd other\npull");

        verify(otherOps).pull();
        verify(ops, never()).pull();
        assertThat(out).contains("Changed directory to: " + root.resolve("other"));
    }

    @Test
    void execute_cd_missingDirectory_keepsCurrentDirectory(@TempDir Path root) {
        when(ops.client()).thenReturn(client);
        when(client.workDir()).thenReturn(root);

        String out = new DslInterpreter(ops).execute("cd nowhere\npull");

        assertThat(out).contains("Error: Directory 'nowhere' does not exist.");
        verify(ops).pull();
    }

    @Test
    void unquote_stripsMatchingQuotes() {
        assertThat(DslInterpreter.unquote("\"hello world\"")).isEqualTo("hello world");
        assertThat(DslInterpreter.unquote("'x'")).isEqualTo("x");
        assertThat(DslInterpreter.unquote("  ")).isNull();
    }
}
