package com.lineage.core.git;

import com.lineage.core.process.TokenEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the tracked text files of a commit, within a token budget, for periodic
 * reconciliation of the artifact against the source.
 */
public class SourceSnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(SourceSnapshotReader.class);

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            ".png", ".jpg", ".jpeg", ".gif", ".webp", ".ico", ".svg",
            ".woff", ".woff2", ".ttf", ".eot",
            ".zip", ".tar", ".gz", ".br", ".jar",
            ".pdf", ".doc", ".docx",
            ".mp3", ".mp4", ".wav", ".webm",
            ".wasm", ".so", ".dylib", ".dll", ".class");

    private final GitHistoryReader reader;
    private final List<Pattern> ignorePatterns;
    private final long maxTokens;

    public SourceSnapshotReader(GitHistoryReader reader, List<String> ignoreGlobs, long maxTokens) {
        this.reader = reader;
        this.ignorePatterns = ignoreGlobs.stream().map(SourceSnapshotReader::globToPattern).toList();
        this.maxTokens = maxTokens;
    }

    /**
     * @param text    files rendered as {@code --- path ---} blocks
     * @param skipped paths left out because of type, ignore patterns or the budget
     */
    public record SourceSnapshot(String text, List<String> skipped) {}

    public SourceSnapshot read(String commitId) {
        var sb = new StringBuilder();
        var skipped = new ArrayList<String>();
        long tokens = 0;
        for (String path : reader.listFiles(commitId)) {
            if (isBinary(path) || isIgnored(path)) {
                skipped.add(path);
                continue;
            }
            String content = reader.readFile(commitId, path).orElse("");
            long fileTokens = TokenEstimator.estimate(content);
            if (tokens + fileTokens > maxTokens) {
                skipped.add(path);
                continue;
            }
            tokens += fileTokens;
            sb.append("--- ").append(path).append(" ---\n").append(content).append("\n\n");
        }
        log.debug("Source snapshot of {}: ~{} tokens, {} files skipped", commitId, tokens, skipped.size());
        return new SourceSnapshot(sb.toString(), skipped);
    }

    boolean isIgnored(String path) {
        String basename = path.substring(path.lastIndexOf('/') + 1);
        return ignorePatterns.stream().anyMatch(p -> p.matcher(basename).matches());
    }

    static boolean isBinary(String path) {
        int dot = path.lastIndexOf('.');
        return dot >= 0 && BINARY_EXTENSIONS.contains(path.substring(dot).toLowerCase(Locale.ROOT));
    }

    static Pattern globToPattern(String glob) {
        var regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*') {
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
