package com.gitagent.server.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@link StatusScanner} backed by {@code git status --porcelain -u}, which lists untracked
 * files individually rather than collapsing them to their directory.
 */
public class GitStatusScanner implements StatusScanner {

    private static final Logger log = LoggerFactory.getLogger(GitStatusScanner.class);

    private final GitClient git;

    public GitStatusScanner(GitClient git) {
        this.git = git;
    }

    @Override
    public Optional<String> scan() {
        try {
            return Optional.of(git.run("status", "--porcelain", "-u").stdout());
        } catch (GitCommandException e) {
            log.warn("Status scan failed in {}: {}", git.workDir(), e.getMessage());
            return Optional.empty();
        }
    }
}
