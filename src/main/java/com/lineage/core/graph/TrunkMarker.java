package com.lineage.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Identifies the trunk by following first parents from the target commit to a root.
 * <p>
 * The graph itself is never modified; trunk membership is returned as a separate {@link Trunk}.
 */
public final class TrunkMarker {

    private static final Logger log = LoggerFactory.getLogger(TrunkMarker.class);

    private TrunkMarker() {}

    /**
     * @param graph the full commit graph
     * @param tipId the resolved id of the target reference
     * @throws IllegalStateException if the tip is absent or no root is reachable
     */
    public static Trunk mark(CommitGraph graph, String tipId) {
        if (!graph.contains(tipId)) {
            throw new IllegalStateException(
                    "Target commit " + tipId + " is not in the commit graph");
        }

        var visited = new LinkedHashSet<String>();
        String current = tipId;
        while (true) {
            if (!visited.add(current)) {
                throw new IllegalStateException("First-parent chain from " + tipId + " revisits " + current);
            }
            CommitNode node = graph.node(current);
            if (node.isRoot()) {
                break;
            }
            String parent = node.parentIds().get(0);
            if (!graph.contains(parent)) {
                throw new IllegalStateException("No root commit reachable from " + tipId
                        + ": first parent " + parent + " of " + current + " is missing (shallow clone?)");
            }
            current = parent;
        }

        List<String> path = new ArrayList<>(visited);
        Collections.reverse(path);
        log.debug("Trunk has {} commits from {} to {}", path.size(), path.get(0), tipId);
        return new Trunk(Collections.unmodifiableList(path), Collections.unmodifiableSet(visited));
    }
}
