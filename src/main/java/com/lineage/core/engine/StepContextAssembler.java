package com.lineage.core.engine;

import com.lineage.core.git.CommitMetadata;
import com.lineage.core.git.GitHistoryReader;
import com.lineage.core.graph.CommitGraph;
import com.lineage.core.graph.CommitNode;
import com.lineage.core.process.StepKind;
import com.lineage.core.process.StepRequest;
import com.lineage.core.process.TokenEstimator;

import java.util.List;

/**
 * Builds the {@link StepRequest} for one commit from its window: summary lines for the
 * context commits and full diffs for the trailing ones.
 */
public class StepContextAssembler {

    private final GitHistoryReader reader;
    private final CommitGraph graph;
    private final List<String> ignorePatterns;
    private final long maxDiffTokens;

    public StepContextAssembler(GitHistoryReader reader, CommitGraph graph,
                                List<String> ignorePatterns, long maxDiffTokens) {
        this.reader = reader;
        this.graph = graph;
        this.ignorePatterns = List.copyOf(ignorePatterns);
        this.maxDiffTokens = maxDiffTokens;
    }

    /**
     * @param request    the request to hand to the step processor
     * @param diffTokens estimated tokens of the diffs before truncation
     */
    public record StepContext(StepRequest request, long diffTokens) {}

    public StepContext assemble(CommitWindow window, String commitId, String priorArtifact, String priorLog) {
        CommitNode node = graph.node(commitId);
        String changes = changesFor(window.fullDiffIds());
        long diffTokens = TokenEstimator.estimate(changes);
        var request = new StepRequest(
                node.isRoot() ? StepKind.INITIAL : StepKind.EVOLVE,
                priorArtifact,
                priorLog,
                commitId,
                node.summary(),
                contextLines(window.contextIds()),
                TokenEstimator.truncate(changes, maxDiffTokens));
        return new StepContext(request, diffTokens);
    }

    /**
     * Diff of a single commit against its first parent, truncated to the budget.
     */
    public String changesOf(String commitId) {
        return TokenEstimator.truncate(changesFor(List.of(commitId)), maxDiffTokens);
    }

    String contextLines(List<String> ids) {
        var sb = new StringBuilder();
        for (String id : ids) {
            sb.append("### ").append(CommitMetadata.shortId(id)).append(" - ")
                    .append(graph.summaryOf(id)).append('\n');
        }
        return sb.toString();
    }

    private String changesFor(List<String> ids) {
        var sb = new StringBuilder();
        for (String id : ids) {
            CommitNode node = graph.node(id);
            sb.append("### ").append(CommitMetadata.shortId(id)).append(" - ").append(node.summary()).append('\n')
                    .append("```diff\n")
                    .append(reader.diff(node, ignorePatterns))
                    .append("\n```\n\n");
        }
        return sb.toString();
    }
}
