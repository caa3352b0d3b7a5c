package com.lineage.core.llm;

import com.lineage.core.process.StepProcessingException;

/**
 * Thrown when LLM output cannot be parsed into the expected type.
 */
public class LlmParseException extends StepProcessingException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
