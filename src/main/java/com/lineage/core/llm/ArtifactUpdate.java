package com.lineage.core.llm;

/**
 * Structured model output shared by all artifact-producing calls.
 *
 * @param artifact       the complete updated artifact
 * @param changelogEntry what changed and why, in a few sentences or bullets
 * @param commitSummary  one line, imperative mood, under 72 characters
 */
public record ArtifactUpdate(String artifact, String changelogEntry, String commitSummary) {}
