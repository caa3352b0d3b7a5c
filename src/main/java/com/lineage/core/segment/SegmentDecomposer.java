package com.lineage.core.segment;

import com.lineage.core.graph.CommitGraph;
import com.lineage.core.graph.CommitNode;
import com.lineage.core.graph.Trunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Partitions a commit graph into trunk, branch and dead-end segments and
 * orders them so that every segment follows its dependencies.
 * <p>
 * Trunk segments are cut at merge commits, so a merge always starts a trunk segment.
 * Side branches are traced from each trunk commit along first-parent children until they
 * merge into the trunk (branch) or run out of children (dead-end). A side branch that keeps
 * going after merging into the trunk is split there, and its continuation depends on the
 * piece before it. A side-branch commit with more than one continuing child is rejected.
 */
public class SegmentDecomposer {

    private static final Logger log = LoggerFactory.getLogger(SegmentDecomposer.class);

    public List<Segment> decompose(CommitGraph graph, Trunk trunk) {
        var segments = new ArrayList<Segment>();
        var owner = new HashMap<String, String>();

        // --- trunk segments, cut before every merge ---
        int trunkIndex = 0;
        var current = new ArrayList<String>();
        for (String id : trunk.path()) {
            if (graph.node(id).isMerge() && !current.isEmpty()) {
                addSegment(segments, owner, new Segment("trunk-" + trunkIndex++, SegmentKind.TRUNK,
                        current, null, null, List.of()));
                current = new ArrayList<>();
            }
            current.add(id);
        }
        addSegment(segments, owner, new Segment("trunk-" + trunkIndex, SegmentKind.TRUNK,
                current, null, null, List.of()));

        // --- side branches, traced from each trunk commit in order ---
        int branchIndex = 0;
        int deadEndIndex = 0;
        for (String trunkId : trunk.path()) {
            for (String childId : graph.node(trunkId).childIds()) {
                if (trunk.contains(childId) || owner.containsKey(childId)
                        || !isFirstParentChild(graph, childId, trunkId)) {
                    continue;
                }
                String forkFrom = trunkId;
                String start = childId;
                while (start != null) {
                    Trace trace = trace(graph, trunk, owner, start);
                    String id = trace.mergesInto() != null
                            ? "branch-" + branchIndex++
                            : "dead-end-" + deadEndIndex++;
                    SegmentKind kind = trace.mergesInto() != null ? SegmentKind.BRANCH : SegmentKind.DEAD_END;
                    addSegment(segments, owner, new Segment(id, kind, trace.commits(), forkFrom,
                            trace.mergesInto(), List.of()));
                    if (trace.continuation() != null) {
                        log.debug("Side branch continues past merge into {} at {}", trace.mergesInto(),
                                trace.continuation());
                    }
                    forkFrom = trace.commits().get(trace.commits().size() - 1);
                    start = trace.continuation();
                }
            }
        }

        int uncovered = graph.size() - owner.size();
        if (uncovered > 0) {
            log.warn("{} commit(s) are not connected to the trunk through first-parent history and will not be processed",
                    uncovered);
        }

        var withDependencies = new ArrayList<Segment>(segments.size());
        for (Segment segment : segments) {
            withDependencies.add(segment.withDependsOn(dependenciesOf(segment, graph, owner)));
        }
        List<Segment> sorted = topologicalSort(withDependencies);
        log.info("Decomposed {} commits into {} segments", owner.size(), sorted.size());
        return sorted;
    }

    private record Trace(List<String> commits, String mergesInto, String continuation) {}

    private Trace trace(CommitGraph graph, Trunk trunk, Map<String, String> owner, String startId) {
        var commits = new ArrayList<String>();
        String currentId = startId;
        while (true) {
            if (owner.containsKey(currentId)) {
                throw new UnsupportedTopologyException("Commit " + currentId + " is reachable along more than one side branch");
            }
            commits.add(currentId);
            CommitNode node = graph.node(currentId);

            String trunkChild = null;
            var continuing = new ArrayList<String>();
            for (String childId : node.childIds()) {
                if (trunk.contains(childId)) {
                    if (trunkChild == null) {
                        trunkChild = childId;
                    }
                } else if (isFirstParentChild(graph, childId, currentId)) {
                    continuing.add(childId);
                }
            }

            if (continuing.size() > 1) {
                throw new UnsupportedTopologyException("Side-branch commit " + currentId + " has "
                        + continuing.size() + " continuing children " + continuing
                        + "; branching within a branch is not supported. "
                        + "Exclude unmerged local branches or process a ref without nested branches.");
            }
            String next = continuing.isEmpty() ? null : continuing.get(0);
            if (trunkChild != null) {
                return new Trace(commits, trunkChild, next);
            }
            if (next == null) {
                return new Trace(commits, null, null);
            }
            currentId = next;
        }
    }

    private static boolean isFirstParentChild(CommitGraph graph, String childId, String parentId) {
        return graph.node(childId).firstParent().map(parentId::equals).orElse(false);
    }

    private static void addSegment(List<Segment> segments, Map<String, String> owner, Segment segment) {
        segments.add(segment);
        for (String id : segment.commitIds()) {
            owner.put(id, segment.id());
        }
    }

    private static List<String> dependenciesOf(Segment segment, CommitGraph graph, Map<String, String> owner) {
        var deps = new LinkedHashSet<String>();
        if (segment.isTrunk()) {
            for (String parentId : graph.node(segment.firstCommit()).parentIds()) {
                String depId = owner.get(parentId);
                if (depId != null && !depId.equals(segment.id())) {
                    deps.add(depId);
                }
            }
        } else if (segment.forkFrom() != null) {
            String depId = owner.get(segment.forkFrom());
            if (depId != null) {
                deps.add(depId);
            }
        }
        return List.copyOf(deps);
    }

    /**
     * Post-order depth-first sort over {@code dependsOn}, iterative so that long trunks
     * cannot exhaust the stack.
     *
     * @throws IllegalStateException on a dependency cycle or an unknown dependency
     */
    static List<Segment> topologicalSort(List<Segment> segments) {
        var byId = new LinkedHashMap<String, Segment>();
        for (Segment segment : segments) {
            byId.put(segment.id(), segment);
        }

        var result = new ArrayList<Segment>(segments.size());
        var state = new HashMap<String, Boolean>(); // false = on stack, true = emitted
        for (Segment root : segments) {
            if (state.containsKey(root.id())) {
                continue;
            }
            var stack = new ArrayDeque<Frame>();
            stack.push(new Frame(root));
            state.put(root.id(), false);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.segment.dependsOn().size()) {
                    String depId = frame.segment.dependsOn().get(frame.next++);
                    Segment dep = byId.get(depId);
                    if (dep == null) {
                        throw new IllegalStateException("Segment " + frame.segment.id()
                                + " depends on unknown segment " + depId);
                    }
                    Boolean depState = state.get(depId);
                    if (depState == null) {
                        state.put(depId, false);
                        stack.push(new Frame(dep));
                    } else if (!depState) {
                        throw new IllegalStateException("Segment dependency cycle through " + depId);
                    }
                } else {
                    stack.pop();
                    state.put(frame.segment.id(), true);
                    result.add(frame.segment);
                }
            }
        }
        return result;
    }

    private static final class Frame {
        private final Segment segment;
        private int next;

        Frame(Segment segment) {
            this.segment = segment;
        }
    }
}
