package com.lineage.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the {@code git} CLI against a single repository via {@link ProcessBuilder}.
 * <p>
 * Standard error is drained on a separate thread so that commands producing
 * large amounts of output on both streams cannot block each other.
 */
public class GitCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    private final Path repoPath;

    public GitCommandRunner(Path repoPath) {
        this.repoPath = repoPath;
    }

    public Path getRepoPath() {
        return repoPath;
    }

    public GitResult run(String... args) {
        return run(Map.of(), null, args);
    }

    /**
     * Runs git with extra environment variables and optional standard input.
     * A non-zero exit is returned, not thrown.
     */
    public GitResult run(Map<String, String> env, String stdin, String... args) {
        return execute(buildCommand(args), env, stdin);
    }

    /**
     * Runs git and returns its standard output, throwing on a non-zero exit.
     */
    public String output(String... args) {
        return output(Map.of(), null, args);
    }

    public String output(Map<String, String> env, String stdin, String... args) {
        var command = buildCommand(args);
        var result = execute(command, env, stdin);
        if (!result.ok()) {
            throw new GitCommandException(command, result.exitCode(), result.stderr());
        }
        return result.stdout();
    }

    List<String> buildCommand(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }

    GitResult execute(List<String> command, Map<String, String> env, String stdin) {
        log.debug("Running: {}", String.join(" ", command));
        try {
            var builder = new ProcessBuilder(command).directory(repoPath.toFile());
            builder.environment().putAll(env);
            var process = builder.start();

            var stderr = new StreamCollector(process.getErrorStream());
            var stderrThread = new Thread(stderr, "git-stderr");
            stderrThread.setDaemon(true);
            stderrThread.start();

            try (OutputStream in = process.getOutputStream()) {
                if (stdin != null) {
                    in.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }

            String stdout;
            try (InputStream out = process.getInputStream()) {
                stdout = new String(out.readAllBytes(), StandardCharsets.UTF_8);
            }

            int exitCode = process.waitFor();
            stderrThread.join();
            if (exitCode != 0) {
                log.debug("Git command exited with code {}: {}", exitCode, String.join(" ", command));
            }
            return new GitResult(exitCode, stdout, stderr.text());
        } catch (IOException e) {
            throw new GitCommandException(command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException(command, e);
        }
    }

    private static final class StreamCollector implements Runnable {

        private final InputStream stream;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        StreamCollector(InputStream stream) {
            this.stream = stream;
        }

        @Override
        public void run() {
            try (stream) {
                stream.transferTo(buffer);
            } catch (IOException e) {
                log.debug("Failed reading git stderr: {}", e.getMessage());
            }
        }

        String text() {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
