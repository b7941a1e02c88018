package com.gitagent.server.git;

/**
 * Captured outcome of one external command.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** stdout with surrounding whitespace removed, the form most callers display. */
    public String output() {
        return stdout.strip();
    }

    /**
     * stdout and stderr together, trimmed. Commands such as checkout report success on
     * stderr only.
     */
    public String combinedOutput() {
        String out = stdout.strip();
        String err = stderr.strip();
        if (out.isEmpty()) return err;
        if (err.isEmpty()) return out;
        return out + "\n" + err;
    }
}
