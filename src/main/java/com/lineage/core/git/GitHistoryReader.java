package com.lineage.core.git;

import com.lineage.core.graph.CommitGraph;
import com.lineage.core.graph.CommitNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries against repository history.
 */
public class GitHistoryReader {

    private static final Logger log = LoggerFactory.getLogger(GitHistoryReader.class);

    static final String FIELD_SEP = "\u001f";
    static final String RECORD_SEP = "\u001e";
    private static final String GRAPH_FORMAT = "--format=%H%x1f%P%x1f%s%x1e";
    private static final String MESSAGE_FORMAT = "--format=%H%x1f%P%x1f%B%x1e";

    private final GitCommandRunner git;

    public GitHistoryReader(GitCommandRunner git) {
        this.git = git;
    }

    /**
     * A commit as read from {@code git log} with its full message.
     */
    public record LoggedCommit(String id, List<String> parentIds, String message) {}

    public Optional<String> resolveCommit(String ref) {
        var result = git.run("rev-parse", "--verify", "--quiet", ref + "^{commit}");
        if (!result.ok() || result.stdout().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(result.stdout().strip());
    }

    /**
     * Builds the commit graph for {@code targetRef}. When {@code excludedBranch} is non-null,
     * every other local branch is read as well so that unmerged branches become part of the graph.
     */
    public CommitGraph readGraph(String targetRef, String excludedBranch) {
        var args = new ArrayList<>(List.of("log", "--reverse", "--topo-order", GRAPH_FORMAT, targetRef));
        if (excludedBranch != null) {
            args.add("--exclude=" + excludedBranch);
            args.add("--branches");
        }
        String output = git.output(args.toArray(String[]::new));

        var builder = CommitGraph.builder();
        int count = 0;
        for (String record : output.split(RECORD_SEP)) {
            String trimmed = record.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = trimmed.split(FIELD_SEP, -1);
            if (fields.length < 3) {
                log.warn("Skipping malformed log record: {}", trimmed);
                continue;
            }
            builder.add(fields[0], splitIds(fields[1]), fields[2]);
            count++;
        }
        log.info("Read {} commits from {}{}", count, targetRef,
                excludedBranch != null ? " and local branches" : "");
        return builder.build();
    }

    /**
     * Commits reachable from {@code ref}, newest first, with full messages.
     *
     * @param firstParent follow only first-parent links
     * @param limit       maximum commits to return, or 0 for no limit
     */
    public List<LoggedCommit> readMessages(String ref, boolean firstParent, int limit) {
        var args = new ArrayList<>(List.of("log", "--topo-order", MESSAGE_FORMAT));
        if (firstParent) {
            args.add("--first-parent");
        }
        if (limit > 0) {
            args.add("-n");
            args.add(String.valueOf(limit));
        }
        args.add(ref);
        String output = git.output(args.toArray(String[]::new));

        var commits = new ArrayList<LoggedCommit>();
        for (String record : output.split(RECORD_SEP)) {
            String trimmed = record.stripLeading();
            if (trimmed.isBlank()) {
                continue;
            }
            String[] fields = trimmed.split(FIELD_SEP, 3);
            if (fields.length < 3) {
                continue;
            }
            commits.add(new LoggedCommit(fields[0].strip(), splitIds(fields[1]), fields[2]));
        }
        return commits;
    }

    /**
     * Patch introduced by {@code node} relative to its first parent, with paths whose
     * basename matches one of {@code ignorePatterns} left out.
     */
    public String diff(CommitNode node, List<String> ignorePatterns) {
        var args = new ArrayList<String>();
        if (node.isRoot()) {
            args.addAll(List.of("diff-tree", "--root", "-p", node.id()));
        } else {
            args.addAll(List.of("diff", node.parentIds().get(0), node.id()));
        }
        args.add("--");
        args.add(".");
        for (String pattern : ignorePatterns) {
            args.add(":(exclude,glob)**/" + pattern);
        }
        return git.output(args.toArray(String[]::new));
    }

    public Optional<String> readFile(String commitId, String path) {
        var result = git.run("show", commitId + ":" + path);
        return result.ok() ? Optional.of(result.stdout()) : Optional.empty();
    }

    public List<String> listFiles(String commitId) {
        String output = git.output("ls-tree", "-r", "-z", "--name-only", commitId);
        return Arrays.stream(output.split("\u0000"))
                .filter(path -> !path.isEmpty())
                .toList();
    }

    private static List<String> splitIds(String field) {
        String trimmed = field.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.of(trimmed.split("\\s+"));
    }
}
