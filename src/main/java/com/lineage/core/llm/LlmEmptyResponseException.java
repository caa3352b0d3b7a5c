package com.lineage.core.llm;

import com.lineage.core.process.StepProcessingException;

/**
 * Thrown when the LLM returns null or blank content instead of a valid response.
 */
public class LlmEmptyResponseException extends StepProcessingException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
