package com.lineage.core.ledger;

/**
 * Outcome of reading the ledger snapshot file.
 *
 * @param status whether the file was absent, unreadable or loaded
 * @param state  the loaded state, or {@code null} unless {@code LOADED}
 * @param detail why a file was considered corrupt, otherwise {@code null}
 */
public record LedgerLoadResult(Status status, EvolutionState state, String detail) {

    public enum Status {
        ABSENT,
        CORRUPT,
        LOADED
    }

    public static LedgerLoadResult absent() {
        return new LedgerLoadResult(Status.ABSENT, null, null);
    }

    public static LedgerLoadResult corrupt(String detail) {
        return new LedgerLoadResult(Status.CORRUPT, null, detail);
    }

    public static LedgerLoadResult loaded(EvolutionState state) {
        return new LedgerLoadResult(Status.LOADED, state, null);
    }
}
