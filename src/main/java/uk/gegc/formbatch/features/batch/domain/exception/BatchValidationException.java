package uk.gegc.formbatch.features.batch.domain.exception;

/**
 * Submitted files violate the job's limits or cannot be read as a batch.
 */
public class BatchValidationException extends RuntimeException {

    public BatchValidationException(String message) {
        super(message);
    }
}
