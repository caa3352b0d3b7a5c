package com.lineage.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ancestry queries over a {@link CommitGraph}.
 */
public final class Ancestry {

    private Ancestry() {}

    /**
     * All commits reachable from {@code startId} through parent links, including itself.
     * Parents outside the graph are ignored.
     */
    public static Set<String> ancestorsOf(CommitGraph graph, String startId) {
        var result = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(startId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!result.add(id)) {
                continue;
            }
            graph.find(id).ifPresent(node -> queue.addAll(node.parentIds()));
        }
        result.retainAll(graph.ids());
        return result;
    }

    /**
     * Up to {@code count} commits on the first-parent chain ending at {@code endId},
     * ordered oldest first and including {@code endId} itself.
     */
    public static List<String> firstParentChain(CommitGraph graph, String endId, int count) {
        var chain = new ArrayList<String>();
        String current = endId;
        while (current != null && chain.size() < count && graph.contains(current)) {
            chain.add(current);
            current = graph.node(current).firstParent().orElse(null);
        }
        Collections.reverse(chain);
        return chain;
    }
}
