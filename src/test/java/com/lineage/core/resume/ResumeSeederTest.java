package com.lineage.core.resume;

import com.lineage.core.git.GitHistoryReader;
import com.lineage.core.graph.CommitGraph;
import com.lineage.core.graph.Trunk;
import com.lineage.core.graph.TrunkMarker;
import com.lineage.core.ledger.CompletedStep;
import com.lineage.core.ledger.ConsistencyException;
import com.lineage.core.ledger.EvolutionState;
import com.lineage.core.ledger.SegmentProgress;
import com.lineage.core.ledger.SegmentStatus;
import com.lineage.core.segment.Segment;
import com.lineage.core.segment.SegmentDecomposer;
import com.lineage.testsupport.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ResumeSeederTest {

    private CommitGraph graph;
    private Trunk trunk;
    private List<Segment> segments;
    private GitHistoryReader reader;
    private ResumeSeeder seeder;

    @BeforeEach
    void setUp() {
        graph = GraphFixtures.referenceGraph();
        trunk = TrunkMarker.mark(graph, "F");
        segments = new SegmentDecomposer().decompose(graph, trunk);
        reader = mock(GitHistoryReader.class);
        when(reader.readFile(anyString(), eq("spec.md"))).thenAnswer(inv -> Optional.of("spec@" + inv.getArgument(0)));
        when(reader.readFile(anyString(), eq("log.md"))).thenAnswer(inv -> Optional.of("log@" + inv.getArgument(0)));
        seeder = new ResumeSeeder(reader, "spec.md", "log.md");
    }

    private static ShadowAnchor anchorAt(String original, List<String> processed, Map<String, String> effectiveTips) {
        var map = new HashMap<String, String>();
        for (String id : processed) {
            map.put(id, "s-" + id);
        }
        return new ShadowAnchor("head", "s-" + original, original, 0, map, effectiveTips);
    }

    private Segment segmentStartingAt(String commitId) {
        return segments.stream().filter(s -> s.firstCommit().equals(commitId)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("ancestors of the anchor are complete, partially covered segments are in progress")
    void seedsFromAnchor() {
        ShadowAnchor anchor = anchorAt("D", List.of("A", "B", "C", "X1", "X2", "M1", "D"), Map.of());

        EvolutionState state = seeder.seed(graph, trunk, segments, anchor);

        SegmentProgress first = state.getSegmentProgress().get(segmentStartingAt("A").id());
        assertEquals(SegmentStatus.COMPLETE, first.getStatus());
        assertEquals(1, first.getCompletedSteps().size());
        assertEquals(CompletedStep.CHECKPOINT_TAG, first.getCompletedSteps().get(0).processorTag());
        assertEquals("C", first.getCompletedSteps().get(0).originalId());
        assertEquals("spec@s-C", first.getCurrentArtifact());

        SegmentProgress branch = state.getSegmentProgress().get(segmentStartingAt("X1").id());
        assertEquals(SegmentStatus.COMPLETE, branch.getStatus());

        SegmentProgress middle = state.getSegmentProgress().get(segmentStartingAt("M1").id());
        assertEquals(SegmentStatus.IN_PROGRESS, middle.getStatus());
        assertEquals(List.of("M1", "D"), middle.getCompletedSteps().stream().map(CompletedStep::originalId).toList());
        assertEquals("s-D", middle.getTipSyntheticId());
        assertEquals("log@s-D", middle.getCurrentLog());

        assertEquals(SegmentStatus.PENDING, state.getSegmentProgress().get(segmentStartingAt("Y1").id()).getStatus());
        assertEquals(SegmentStatus.PENDING, state.getSegmentProgress().get(segmentStartingAt("Z1").id()).getStatus());
    }

    @Test
    @DisplayName("counters reflect the recovered steps and start a fresh reconciliation interval")
    void counters() {
        ShadowAnchor anchor = anchorAt("D", List.of("A", "B", "C", "X1", "X2", "M1", "D"), Map.of());

        EvolutionState state = seeder.seed(graph, trunk, segments, anchor);

        assertEquals(7, state.getTotalSteps());
        assertEquals(5, state.getTrunkSteps());
        assertEquals(7, state.getLastReconciliationStep());
        assertEquals(5, state.getLastReconciliationTrunkStep());
        assertEquals("head", state.getShadowHeadId());
        assertEquals("A", state.getRootCommit());
    }

    @Test
    @DisplayName("a reconciliation above a step becomes the segment's tip")
    void effectiveTip() {
        ShadowAnchor anchor = anchorAt("B", List.of("A", "B"), Map.of("B", "rec-B"));

        EvolutionState state = seeder.seed(graph, trunk, segments, anchor);

        SegmentProgress first = state.getSegmentProgress().get(segmentStartingAt("A").id());
        assertEquals("rec-B", first.getTipSyntheticId());
        assertEquals("spec@rec-B", first.getCurrentArtifact());
    }

    @Test
    @DisplayName("an anchor outside the target's history is a consistency error")
    void orphanAnchor() {
        ShadowAnchor anchor = anchorAt("gone", List.of("gone"), Map.of());

        var ex = assertThrows(ConsistencyException.class, () -> seeder.seed(graph, trunk, segments, anchor));
        assertEquals(List.of("gone"), ex.getMissingCommits());
    }

    @Test
    @DisplayName("an anchor on an unmerged branch is not in the target's history")
    void anchorOnDeadEnd() {
        ShadowAnchor anchor = anchorAt("Z2", List.of("A", "B", "C", "Z1", "Z2"), Map.of());

        assertThrows(ConsistencyException.class, () -> seeder.seed(graph, trunk, segments, anchor));
    }

    @Test
    @DisplayName("a processed commit without a synthetic counterpart is a consistency error")
    void missingSynthetic() {
        ShadowAnchor anchor = anchorAt("B", List.of("B"), Map.of());

        var ex = assertThrows(ConsistencyException.class, () -> seeder.seed(graph, trunk, segments, anchor));
        assertEquals(List.of("A"), ex.getMissingCommits());
    }
}
