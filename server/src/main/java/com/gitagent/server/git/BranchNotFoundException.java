package com.gitagent.server.git;

/**
 * Thrown when a branch name matches neither a local branch nor a remote-tracking one.
 */
public class BranchNotFoundException extends RuntimeException {

    public BranchNotFoundException(String branch) {
        super("Branch '" + branch + "' not found");
    }
}
