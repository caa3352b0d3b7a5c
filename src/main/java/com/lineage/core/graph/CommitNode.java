package com.lineage.core.graph;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A single commit in the {@link CommitGraph}.
 *
 * @param id        full commit id
 * @param parentIds parents in recorded order; the first entry is the first parent
 * @param childIds  commits that list this one as a parent, in history order
 * @param summary   commit subject line
 */
public record CommitNode(
        String id,
        List<String> parentIds,
        Set<String> childIds,
        String summary
) {

    public boolean isRoot() {
        return parentIds.isEmpty();
    }

    public boolean isMerge() {
        return parentIds.size() > 1;
    }

    public Optional<String> firstParent() {
        return parentIds.isEmpty() ? Optional.empty() : Optional.of(parentIds.get(0));
    }
}
