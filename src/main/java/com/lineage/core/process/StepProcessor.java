package com.lineage.core.process;

/**
 * Derives the next artifact from the prior one and a commit's changes.
 * <p>
 * Retries are the implementation's concern. Any exception that escapes fails the segment.
 */
public interface StepProcessor {

    StepResult process(StepRequest request);
}
