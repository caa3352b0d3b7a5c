package com.lineage.core.llm;

import com.lineage.core.process.StepKind;
import com.lineage.core.process.StepProcessor;
import com.lineage.core.process.StepRequest;
import com.lineage.core.process.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evolves the specification by one commit with a single structured LLM call.
 */
@Component
public class LlmStepProcessor implements StepProcessor {

    private static final Logger log = LoggerFactory.getLogger(LlmStepProcessor.class);

    private static final String INITIAL_SYSTEM_PROMPT = """
            You are a technical writer reverse-engineering a software specification from
            version-control history. You are shown the very first commit of a repository.

            Write the initial specification of the system as it exists after this commit:
            1. State its purpose and scope in a short overview
            2. Describe each component, its responsibilities and its interfaces
            3. Record data formats, configuration and external dependencies you can see
            4. Describe behaviour, not implementation details such as variable names

            Respond with valid JSON matching the schema provided.
            """;

    private static final String EVOLVE_SYSTEM_PROMPT = """
            You are a technical writer maintaining a software specification that is derived,
            one commit at a time, from version-control history.

            You are given the current specification, recent commit context, and the changes of
            the commit being processed. Update the specification so that it describes the
            system after this commit:
            1. Change only what the commit actually changes; keep everything else verbatim
            2. Add new components and behaviour, revise changed ones, remove deleted ones
            3. Ignore formatting-only, dependency-bump and generated-file changes
            4. Return the complete specification, never a fragment or a diff

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final LlmProperties properties;

    public LlmStepProcessor(LlmService llmService, LlmProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public StepResult process(StepRequest request) {
        boolean initial = request.kind() == StepKind.INITIAL || request.priorArtifact() == null
                || request.priorArtifact().isBlank();
        String systemPrompt = initial ? INITIAL_SYSTEM_PROMPT : EVOLVE_SYSTEM_PROMPT;
        String model = properties.getModel();

        LlmService.StructuredResult<ArtifactUpdate> result = llmService.structuredCall(
                systemPrompt, buildUserPrompt(request, initial), ArtifactUpdate.class, model);
        ArtifactUpdate update = result.value();
        if (update == null || update.artifact() == null || update.artifact().isBlank()) {
            throw new LlmEmptyResponseException("Model returned no specification for commit " + request.commitId());
        }
        log.debug("Commit {} processed by {} ({} tokens)", request.commitId(), model, result.totalTokens());
        return new StepResult(update.artifact(), orEmpty(update.changelogEntry()),
                summaryOrDefault(update.commitSummary(), request.commitSummary()), result.cost(), model);
    }

    private String buildUserPrompt(StepRequest request, boolean initial) {
        if (initial) {
            return String.format("""
                    Commit: %s
                    Message: %s

                    Changes:
                    %s
                    """, request.commitId(), request.commitSummary(), request.changes());
        }
        return String.format("""
                Current specification:
                %s

                Recent commits:
                %s
                Commit being processed: %s
                Message: %s

                Changes:
                %s
                """,
                request.priorArtifact(),
                request.contextCommits().isBlank() ? "(none)\n" : request.contextCommits(),
                request.commitId(),
                request.commitSummary(),
                request.changes());
    }

    static String summaryOrDefault(String summary, String fallback) {
        return summary == null || summary.isBlank() ? "Update specification for: " + fallback : summary.strip();
    }

    static String orEmpty(String text) {
        return text == null ? "" : text;
    }
}
