package uk.gegc.formbatch.features.batch.domain.model;

/**
 * Why a job ended in {@link BatchStatus#FAILED}. Lets callers tell "no PDFs were made"
 * apart from "PDFs were made but could not be delivered".
 */
public enum FailureKind {
    /** Input rejected before any credits were touched. */
    VALIDATION,
    /** Reservation refused; nothing was debited. */
    INSUFFICIENT_CREDITS,
    /** Every processed row failed. */
    NO_ROWS_SUCCEEDED,
    /** Cancelled before any row succeeded. */
    CANCELLED,
    /** Rows were generated and charged but the archive could not be built. */
    PACKAGING,
    INTERNAL
}
