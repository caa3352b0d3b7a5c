package com.lineage.testsupport;

import com.lineage.core.graph.CommitGraph;

import java.util.List;

/**
 * In-memory commit graphs with readable ids, for tests that need no repository.
 */
public final class GraphFixtures {

    private GraphFixtures() {}

    /**
     * The reference topology:
     * <pre>
     * A - B - C ------- M1 - D - E ------- M2 - F
     *          \       /         \        /
     *           X1 - X2           Z1 - Z2 (never merged)
     *          \                         /
     *           Y1 - Y2 - Y3 ------------
     * </pre>
     */
    public static CommitGraph referenceGraph() {
        return CommitGraph.builder()
                .add("A", List.of(), "initial")
                .add("B", List.of("A"), "add parser")
                .add("C", List.of("B"), "add lexer")
                .add("X1", List.of("C"), "x: start feature")
                .add("X2", List.of("X1"), "x: finish feature")
                .add("Y1", List.of("C"), "y: start rewrite")
                .add("Y2", List.of("Y1"), "y: continue rewrite")
                .add("Y3", List.of("Y2"), "y: finish rewrite")
                .add("M1", List.of("C", "X2"), "Merge branch-x")
                .add("D", List.of("M1"), "add cache")
                .add("E", List.of("D"), "add metrics")
                .add("Z1", List.of("E"), "z: experiment")
                .add("Z2", List.of("Z1"), "z: experiment more")
                .add("M2", List.of("E", "Y3"), "Merge branch-y")
                .add("F", List.of("M2"), "release")
                .build();
    }

    public static CommitGraph linear(String... ids) {
        var builder = CommitGraph.builder();
        String previous = null;
        for (String id : ids) {
            builder.add(id, previous == null ? List.of() : List.of(previous), "commit " + id);
            previous = id;
        }
        return builder.build();
    }
}
