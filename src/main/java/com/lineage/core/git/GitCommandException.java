package com.lineage.core.git;

import java.util.List;

/**
 * Thrown when a git command exits non-zero or cannot be started.
 */
public class GitCommandException extends RuntimeException {

    private final List<String> command;
    private final int exitCode;
    private final String stderr;

    public GitCommandException(List<String> command, int exitCode, String stderr) {
        super("Git command failed (exit code %d): %s%s".formatted(
                exitCode, String.join(" ", command),
                stderr == null || stderr.isBlank() ? "" : " - " + stderr.strip()));
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public GitCommandException(List<String> command, Throwable cause) {
        super("Git command failed: " + String.join(" ", command), cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
        this.stderr = "";
    }

    public List<String> getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
