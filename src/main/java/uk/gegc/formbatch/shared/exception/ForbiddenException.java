package uk.gegc.formbatch.shared.exception;

/**
 * Raised when an actor lacks the capability an operation requires.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
