package com.lineage.core.process;

/**
 * Thrown when an external collaborator cannot produce a result.
 */
public class StepProcessingException extends RuntimeException {

    public StepProcessingException(String message) {
        super(message);
    }

    public StepProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
