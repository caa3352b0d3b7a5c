package com.lineage.core.engine;

import java.util.List;

/**
 * How {@link EvolutionEngine#setup} initialized the ledger.
 *
 * @param mode                where progress came from
 * @param warnings            recoverable anomalies found while deciding, for display
 * @param commitsBeyondAnchor untagged shadow commits above the anchor (cold resume only)
 * @param anchorOriginalId    original commit of the resume anchor (cold resume only)
 */
public record ResumeInfo(Mode mode, List<String> warnings, int commitsBeyondAnchor, String anchorOriginalId) {

    public enum Mode {
        FRESH,
        LEDGER,
        SHADOW_HISTORY
    }

    public ResumeInfo {
        warnings = List.copyOf(warnings);
    }
}
