package com.lineage.core.process;

/**
 * Kind of processing step, used to pick prompts and for estimation.
 */
public enum StepKind {
    /** The repository's root commit; there is no prior artifact. */
    INITIAL,
    /** An ordinary commit that evolves the prior artifact. */
    EVOLVE,
    /** A merge commit reconciling two upstream artifacts. */
    MERGE
}
