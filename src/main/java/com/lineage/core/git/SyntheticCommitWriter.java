package com.lineage.core.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes synthetic commits using git plumbing only, without touching the
 * working tree or the repository's own index.
 * <p>
 * Each call stages into its own temporary index file under the git directory,
 * so concurrent calls never share staging state. The temporary index is removed
 * on every exit path.
 */
public class SyntheticCommitWriter {

    private static final Logger log = LoggerFactory.getLogger(SyntheticCommitWriter.class);

    private final GitCommandRunner git;
    private final String authorName;
    private final String authorEmail;
    private volatile Path gitDir;

    public SyntheticCommitWriter(GitCommandRunner git, String authorName, String authorEmail) {
        this.git = git;
        this.authorName = authorName;
        this.authorEmail = authorEmail;
    }

    /**
     * Creates a commit whose tree is the tree of {@code originalId} with {@code files}
     * added or overwritten, and whose parents are exactly {@code parentIds}.
     *
     * @param originalId commit whose tree is the base
     * @param parentIds  synthetic parents in order; may be empty for a root commit
     * @param files      repository-relative path to file content
     * @param message    full commit message
     * @return the new commit id
     */
    public String write(String originalId, List<String> parentIds, Map<String, String> files, String message) {
        Path tempIndex = gitDir().resolve("index.lineage." + UUID.randomUUID().toString().replace("-", ""));
        Map<String, String> indexEnv = Map.of("GIT_INDEX_FILE", tempIndex.toString());
        try {
            String baseTree = git.output("rev-parse", originalId + "^{tree}").strip();
            git.output(indexEnv, null, "read-tree", baseTree);

            for (var file : files.entrySet()) {
                String blob = git.output(Map.of(), file.getValue(), "hash-object", "-w", "--stdin").strip();
                git.output(indexEnv, null, "update-index", "--add", "--cacheinfo",
                        "100644," + blob + "," + file.getKey());
            }

            String tree = git.output(indexEnv, null, "write-tree").strip();

            var args = new ArrayList<String>();
            args.add("commit-tree");
            args.add(tree);
            for (String parentId : parentIds) {
                args.add("-p");
                args.add(parentId);
            }
            args.add("-F");
            args.add("-");
            String commitId = git.output(identityEnv(), message, args.toArray(String[]::new)).strip();
            log.debug("Wrote synthetic commit {} for {} (parents {})", commitId, originalId, parentIds);
            return commitId;
        } finally {
            deleteQuietly(tempIndex);
            deleteQuietly(tempIndex.resolveSibling(tempIndex.getFileName() + ".lock"));
        }
    }

    private Map<String, String> identityEnv() {
        var env = new HashMap<String, String>();
        env.put("GIT_AUTHOR_NAME", authorName);
        env.put("GIT_AUTHOR_EMAIL", authorEmail);
        env.put("GIT_COMMITTER_NAME", authorName);
        env.put("GIT_COMMITTER_EMAIL", authorEmail);
        return env;
    }

    private Path gitDir() {
        Path dir = gitDir;
        if (dir == null) {
            dir = Path.of(git.output("rev-parse", "--absolute-git-dir").strip());
            gitDir = dir;
        }
        return dir;
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to remove temporary index {}: {}", path, e.getMessage());
        }
    }
}
