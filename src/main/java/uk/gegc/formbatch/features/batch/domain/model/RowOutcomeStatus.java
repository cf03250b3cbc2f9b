package uk.gegc.formbatch.features.batch.domain.model;

public enum RowOutcomeStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
