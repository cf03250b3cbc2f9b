package uk.gegc.formbatch.features.limits.domain.exception;

public class InvalidLimitOverrideException extends RuntimeException {

    public InvalidLimitOverrideException(String message) {
        super(message);
    }
}
