package com.lineage.core.engine;

import com.lineage.config.EvolutionConfig;
import com.lineage.core.git.GitCommandRunner;
import com.lineage.core.graph.CommitGraph;
import com.lineage.core.graph.Trunk;
import com.lineage.core.ledger.StateLedger;
import com.lineage.core.segment.Segment;

import java.util.List;

/**
 * Everything {@link EvolutionEngine#setup} worked out, ready to be handed to
 * {@link EvolutionEngine#run}.
 */
public record SetupResult(
        EvolutionConfig config,
        GitCommandRunner git,
        CommitGraph graph,
        Trunk trunk,
        List<Segment> segments,
        StateLedger ledger,
        ResumeInfo resume,
        SetupStats stats,
        boolean dryRun
) {

    public SetupResult {
        segments = List.copyOf(segments);
    }
}
