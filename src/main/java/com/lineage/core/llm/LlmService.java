package com.lineage.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} to produce structured (typed) output from LLM calls.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the target class, append
 * format instructions to the user prompt, and deserialize the response. Output that cannot be
 * parsed is retried up to {@code lineage.llm.max-parse-retries} times.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper lenientMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .registerModule(new ParameterNamesModule());

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("LlmService initialized, step model {}, merge model {}",
                properties.getModel(), properties.getMergeModel());
    }

    /**
     * A parsed response together with what it cost.
     *
     * @param value       the deserialized output
     * @param totalTokens prompt plus completion tokens over all attempts
     * @param cost        {@code totalTokens} priced at the configured rate, in USD
     */
    public record StructuredResult<T>(T value, long totalTokens, double cost) {}

    /**
     * Sends a system + user prompt to {@code model} and returns the response deserialized
     * into {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the last attempt returned no content
     * @throws LlmParseException         if the last attempt could not be parsed
     */
    public <T> StructuredResult<T> structuredCall(String systemPrompt, String userPrompt,
                                                  Class<T> outputType, String model) {
        var converter = new BeanOutputConverter<>(outputType);
        int attempts = 1 + Math.max(0, properties.getMaxParseRetries());
        long tokens = 0;
        for (int attempt = 1; ; attempt++) {
            log.debug("LLM call {} of {} -> {} on {}", attempt, attempts, outputType.getSimpleName(), model);
            long start = System.currentTimeMillis();
            ChatResponse response = chatClient.prompt()
                    .options(ChatOptions.builder().model(model).build())
                    .system(systemPrompt)
                    .user(userPrompt + "\n\n" + converter.getFormat())
                    .call()
                    .chatResponse();
            tokens += tokensOf(response);
            String content = contentOf(response);
            log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(),
                    String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
            try {
                if (content == null || content.isBlank()) {
                    throw new LlmEmptyResponseException("LLM returned empty content for "
                            + outputType.getSimpleName() + ". Check that model " + model
                            + " is available and supports structured JSON output.");
                }
                T value = parse(converter, content, outputType);
                return new StructuredResult<>(value, tokens, properties.costOf(tokens));
            } catch (LlmParseException | LlmEmptyResponseException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.warn("Attempt {} of {} for {} failed ({}); retrying", attempt, attempts,
                        outputType.getSimpleName(), e.getMessage());
            }
        }
    }

    private <T> T parse(BeanOutputConverter<T> converter, String content, Class<T> outputType) {
        try {
            return converter.convert(content);
        } catch (RuntimeException e) {
            log.debug("Schema conversion failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            return parseWithJackson(content, outputType);
        }
    }

    /**
     * Fallback parsing with lenient settings, after stripping a markdown code fence.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = json.strip();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        try {
            return lenientMapper.readValue(cleaned.strip(), outputType);
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    private static String contentOf(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }

    private static long tokensOf(ChatResponse response) {
        if (response == null || response.getMetadata() == null) {
            return 0;
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage == null || usage.getTotalTokens() == null) {
            return 0;
        }
        return usage.getTotalTokens();
    }
}
