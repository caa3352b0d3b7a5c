package com.lineage.core.segment;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A maximal linear run of commits processed as one unit.
 *
 * @param id         stable id such as {@code trunk-0}, {@code branch-2} or {@code dead-end-0}
 * @param kind       trunk, branch or dead-end
 * @param commitIds  commits oldest to newest; never empty
 * @param forkFrom   commit the segment grows from, or {@code null} for trunk segments
 * @param mergesInto trunk commit the segment merges into, or {@code null}
 * @param dependsOn  ids of segments that must complete first, without duplicates
 */
public record Segment(
        String id,
        SegmentKind kind,
        List<String> commitIds,
        String forkFrom,
        String mergesInto,
        List<String> dependsOn
) {

    public Segment {
        if (commitIds == null || commitIds.isEmpty()) {
            throw new IllegalArgumentException("Segment " + id + " has no commits");
        }
        commitIds = List.copyOf(commitIds);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    @JsonIgnore
    public String firstCommit() {
        return commitIds.get(0);
    }

    @JsonIgnore
    public String lastCommit() {
        return commitIds.get(commitIds.size() - 1);
    }

    public int size() {
        return commitIds.size();
    }

    @JsonIgnore
    public boolean isTrunk() {
        return kind == SegmentKind.TRUNK;
    }

    Segment withDependsOn(List<String> dependencies) {
        return new Segment(id, kind, commitIds, forkFrom, mergesInto, dependencies);
    }
}
