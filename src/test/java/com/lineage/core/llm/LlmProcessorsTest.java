package com.lineage.core.llm;

import com.lineage.core.process.MergeRequest;
import com.lineage.core.process.MergeResult;
import com.lineage.core.process.SourceReconciliationRequest;
import com.lineage.core.process.SourceReconciliationResult;
import com.lineage.core.process.StepKind;
import com.lineage.core.process.StepRequest;
import com.lineage.core.process.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the LLM-backed step processor and reconcilers, with {@link LlmService} mocked.
 */
class LlmProcessorsTest {

    private LlmService llmService;
    private LlmProperties properties;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        properties = new LlmProperties();
        properties.setModel("step-model");
        properties.setMergeModel("merge-model");
    }

    private void respond(ArtifactUpdate update) {
        when(llmService.structuredCall(anyString(), anyString(), eq(ArtifactUpdate.class), anyString()))
                .thenReturn(new LlmService.StructuredResult<>(update, 1000, 0.002));
    }

    // -- Step processor -------------------------------------------------------

    @Nested
    @DisplayName("LlmStepProcessor")
    class StepProcessorTests {

        private LlmStepProcessor processor;

        @BeforeEach
        void setUp() {
            processor = new LlmStepProcessor(llmService, properties);
        }

        @Test
        @DisplayName("an initial step omits the prior specification")
        void initialStep() {
            respond(new ArtifactUpdate("# Spec", "Created.", "Describe initial system"));

            StepResult result = processor.process(new StepRequest(StepKind.INITIAL, "", "",
                    "abc123", "initial commit", "", "diff --git a/x b/x"));

            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(llmService).structuredCall(anyString(), user.capture(), eq(ArtifactUpdate.class), eq("step-model"));
            assertFalse(user.getValue().contains("Current specification"));
            assertTrue(user.getValue().contains("diff --git a/x b/x"));
            assertEquals("# Spec", result.newArtifact());
            assertEquals("step-model", result.processorTag());
            assertEquals(0.002, result.cost(), 1e-9);
        }

        @Test
        @DisplayName("an evolve step carries the prior specification and commit context")
        void evolveStep() {
            respond(new ArtifactUpdate("# Spec v2", "Changed.", "Describe cache"));

            processor.process(new StepRequest(StepKind.EVOLVE, "# Spec v1", "log", "def456", "add cache",
                    "### abc12345 - initial commit\n", "diff"));

            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(llmService).structuredCall(anyString(), user.capture(), eq(ArtifactUpdate.class), anyString());
            assertTrue(user.getValue().contains("# Spec v1"));
            assertTrue(user.getValue().contains("### abc12345 - initial commit"));
        }

        @Test
        @DisplayName("falls back to a generated summary and an empty log entry")
        void defaults() {
            respond(new ArtifactUpdate("# Spec", null, " "));

            StepResult result = processor.process(new StepRequest(StepKind.EVOLVE, "# Spec", "", "id",
                    "add cache", "", ""));

            assertEquals("Update specification for: add cache", result.commitSummary());
            assertEquals("", result.logEntry());
        }

        @Test
        @DisplayName("an empty artifact is a failure")
        void emptyArtifact() {
            respond(new ArtifactUpdate("", "x", "y"));

            assertThrows(LlmEmptyResponseException.class, () -> processor.process(
                    new StepRequest(StepKind.EVOLVE, "# Spec", "", "id", "s", "", "")));
        }
    }

    // -- Merge reconciler -----------------------------------------------------

    @Nested
    @DisplayName("LlmMergeReconciler")
    class MergeReconcilerTests {

        @Test
        @DisplayName("presents both sides to the merge model")
        void reconcile() {
            respond(new ArtifactUpdate("# Unified", "Merged.", "Merge feature"));
            var reconciler = new LlmMergeReconciler(llmService, properties);

            MergeResult result = reconciler.reconcile(new MergeRequest("# Trunk", "", "# Branch", "",
                    "m1", "Merge branch-x", "diff", "trunk-1", "branch-0"));

            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(llmService).structuredCall(anyString(), user.capture(), eq(ArtifactUpdate.class), eq("merge-model"));
            assertTrue(user.getValue().contains("# Trunk"));
            assertTrue(user.getValue().contains("# Branch"));
            assertEquals("# Unified", result.unifiedArtifact());
            assertEquals("Merge feature", result.commitSummary());
        }
    }

    // -- Source reconciler ----------------------------------------------------

    @Nested
    @DisplayName("LlmSourceReconciler")
    class SourceReconcilerTests {

        @Test
        @DisplayName("lists skipped files and defaults the summary")
        void reconcile() {
            respond(new ArtifactUpdate("# Corrected", "Fixed drift.", null));
            var reconciler = new LlmSourceReconciler(llmService, properties);

            SourceReconciliationResult result = reconciler.reconcile(new SourceReconciliationRequest("# Spec",
                    "abc", "--- a.txt ---\nA\n", List.of("logo.png")));

            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(llmService).structuredCall(anyString(), user.capture(), eq(ArtifactUpdate.class), eq("merge-model"));
            assertTrue(user.getValue().contains("logo.png"));
            assertEquals("# Corrected", result.updatedArtifact());
            assertEquals("Reconcile specification with source", result.commitSummary());
        }
    }
}
