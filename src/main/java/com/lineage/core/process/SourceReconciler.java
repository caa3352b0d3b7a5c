package com.lineage.core.process;

/**
 * Periodically corrects drift between the artifact and the actual source tree.
 */
public interface SourceReconciler {

    SourceReconciliationResult reconcile(SourceReconciliationRequest request);
}
