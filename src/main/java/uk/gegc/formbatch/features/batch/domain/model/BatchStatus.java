package uk.gegc.formbatch.features.batch.domain.model;

/**
 * Lifecycle of a batch job. Jobs move forward only; the last three states are terminal.
 */
public enum BatchStatus {
    SUBMITTED,
    VALIDATING,
    RESERVING,
    PROCESSING,
    PACKAGING,
    COMPLETED,
    PARTIALLY_COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_COMPLETED || this == FAILED;
    }
}
