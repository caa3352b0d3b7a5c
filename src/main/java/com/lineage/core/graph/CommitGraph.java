package com.lineage.core.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable in-memory commit graph built once per run.
 * <p>
 * Parent links that point outside the graph (shallow history) are kept on the
 * node but produce no child link.
 */
public final class CommitGraph {

    private final Map<String, CommitNode> nodes;

    private CommitGraph(Map<String, CommitNode> nodes) {
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<CommitNode> find(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public CommitNode node(String id) {
        CommitNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Commit " + id + " is not in the commit graph");
        }
        return node;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Set<String> ids() {
        return nodes.keySet();
    }

    public Collection<CommitNode> nodes() {
        return nodes.values();
    }

    public String summaryOf(String id) {
        CommitNode node = nodes.get(id);
        return node != null ? node.summary() : "unknown";
    }

    /**
     * Accumulates commits in any order and links children on {@link #build()}.
     * Commits should be added parents-first for a stable child order.
     */
    public static final class Builder {

        private final Map<String, List<String>> parents = new LinkedHashMap<>();
        private final Map<String, String> summaries = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(String id, List<String> parentIds, String summary) {
            parents.put(id, List.copyOf(parentIds));
            summaries.put(id, summary == null ? "" : summary);
            return this;
        }

        public CommitGraph build() {
            var children = new LinkedHashMap<String, Set<String>>();
            for (String id : parents.keySet()) {
                children.put(id, new LinkedHashSet<>());
            }
            for (var entry : parents.entrySet()) {
                for (String parentId : entry.getValue()) {
                    Set<String> siblings = children.get(parentId);
                    if (siblings != null) {
                        siblings.add(entry.getKey());
                    }
                }
            }

            var nodes = new LinkedHashMap<String, CommitNode>();
            for (var entry : parents.entrySet()) {
                String id = entry.getKey();
                nodes.put(id, new CommitNode(
                        id,
                        entry.getValue(),
                        Collections.unmodifiableSet(children.get(id)),
                        summaries.get(id)));
            }
            return new CommitGraph(nodes);
        }
    }
}
