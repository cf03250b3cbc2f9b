package uk.gegc.formbatch.features.batch.domain.exception;

public class JobAlreadyFinishedException extends RuntimeException {

    public JobAlreadyFinishedException(String message) {
        super(message);
    }
}
