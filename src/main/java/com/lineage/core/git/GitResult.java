package com.lineage.core.git;

/**
 * Captured outcome of a single git invocation.
 *
 * @param exitCode process exit code
 * @param stdout   standard output, undecorated
 * @param stderr   standard error
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public boolean ok() {
        return exitCode == 0;
    }
}
