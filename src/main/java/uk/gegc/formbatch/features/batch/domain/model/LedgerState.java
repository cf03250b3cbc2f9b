package uk.gegc.formbatch.features.batch.domain.model;

/**
 * Where the job's credit reservation stands.
 */
public enum LedgerState {

    NONE,

    RESERVED,

    /**
     * Final charge recorded; at least one row billed.
     */
    COMMITTED,

    /**
     * Reservation returned in full.
     */
    RELEASED;

    public boolean isReserved() {
        return this == RESERVED;
    }

    public boolean isTerminal() {
        return this == COMMITTED || this == RELEASED;
    }
}
