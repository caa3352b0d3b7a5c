package com.lineage.core.llm;

import com.lineage.core.process.MergeReconciler;
import com.lineage.core.process.MergeRequest;
import com.lineage.core.process.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the trunk and branch versions of the specification at a merge commit.
 */
@Component
public class LlmMergeReconciler implements MergeReconciler {

    private static final Logger log = LoggerFactory.getLogger(LlmMergeReconciler.class);

    private static final String SYSTEM_PROMPT = """
            You are a technical writer merging two versions of a software specification.
            Both versions were derived from the same starting point: one followed the main
            line of development, the other followed a side branch that is now being merged.

            Produce a single specification that:
            1. Keeps every addition and change from both versions
            2. Resolves contradictions in favour of what the merge commit's changes show
            3. Removes duplicated sections, keeping the more complete wording
            4. Reads as one coherent document, not two documents glued together

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final LlmProperties properties;

    public LlmMergeReconciler(LlmService llmService, LlmProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public MergeResult reconcile(MergeRequest request) {
        String model = properties.getMergeModel();
        String userPrompt = String.format("""
                Main-line specification (%s):
                %s

                Branch specification (%s):
                %s

                Merge commit: %s
                Message: %s

                Merge changes:
                %s
                """,
                request.trunkSegmentId(), request.trunkArtifact(),
                request.branchSegmentId(), request.branchArtifact(),
                request.mergeCommitId(), request.mergeSummary(),
                request.changes());

        LlmService.StructuredResult<ArtifactUpdate> result =
                llmService.structuredCall(SYSTEM_PROMPT, userPrompt, ArtifactUpdate.class, model);
        ArtifactUpdate update = result.value();
        if (update == null || update.artifact() == null || update.artifact().isBlank()) {
            throw new LlmEmptyResponseException("Model returned no merged specification for " + request.mergeCommitId());
        }
        log.debug("Merged {} into {} with {} ({} tokens)", request.branchSegmentId(), request.trunkSegmentId(),
                model, result.totalTokens());
        return new MergeResult(update.artifact(), LlmStepProcessor.orEmpty(update.changelogEntry()),
                LlmStepProcessor.summaryOrDefault(update.commitSummary(), request.mergeSummary()), result.cost());
    }
}
