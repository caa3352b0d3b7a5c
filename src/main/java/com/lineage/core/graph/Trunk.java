package com.lineage.core.graph;

import java.util.List;
import java.util.Set;

/**
 * The mainline of a {@link CommitGraph}: the first-parent chain from the
 * target commit back to a root.
 *
 * @param path trunk commit ids ordered root to tip
 * @param ids  the same ids as a set for membership checks
 */
public record Trunk(List<String> path, Set<String> ids) {

    public boolean contains(String id) {
        return ids.contains(id);
    }

    public String root() {
        return path.get(0);
    }

    public String tip() {
        return path.get(path.size() - 1);
    }
}
