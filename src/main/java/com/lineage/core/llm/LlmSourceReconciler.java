package com.lineage.core.llm;

import com.lineage.core.process.SourceReconciler;
import com.lineage.core.process.SourceReconciliationRequest;
import com.lineage.core.process.SourceReconciliationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Corrects drift between the specification and the source tree it describes.
 */
@Component
public class LlmSourceReconciler implements SourceReconciler {

    private static final Logger log = LoggerFactory.getLogger(LlmSourceReconciler.class);

    private static final String SYSTEM_PROMPT = """
            You are auditing a software specification against the source code it describes.
            The specification was built up incrementally and may have drifted.

            Compare the specification with the source files provided and:
            1. Correct statements the source contradicts
            2. Add significant behaviour present in the source but missing from the specification
            3. Remove features that no longer exist in the source
            4. Leave alone anything about files listed as not provided; absence there is not removal

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final LlmProperties properties;

    public LlmSourceReconciler(LlmService llmService, LlmProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public SourceReconciliationResult reconcile(SourceReconciliationRequest request) {
        String model = properties.getMergeModel();
        String skipped = request.skippedFiles().isEmpty() ? "(none)" : String.join("\n", request.skippedFiles());
        String userPrompt = String.format("""
                Current specification:
                %s

                Source at commit %s:
                %s

                Files not provided:
                %s
                """, request.currentArtifact(), request.commitId(), request.sources(), skipped);

        LlmService.StructuredResult<ArtifactUpdate> result =
                llmService.structuredCall(SYSTEM_PROMPT, userPrompt, ArtifactUpdate.class, model);
        ArtifactUpdate update = result.value();
        if (update == null || update.artifact() == null || update.artifact().isBlank()) {
            throw new LlmEmptyResponseException("Model returned no reconciled specification for " + request.commitId());
        }
        log.debug("Reconciled against {} with {} ({} tokens)", request.commitId(), model, result.totalTokens());
        return new SourceReconciliationResult(update.artifact(), LlmStepProcessor.orEmpty(update.changelogEntry()),
                update.commitSummary() == null || update.commitSummary().isBlank()
                        ? "Reconcile specification with source" : update.commitSummary().strip(),
                result.cost());
    }
}
