package uk.gegc.formbatch.features.pdf.domain.exception;

/**
 * Exception thrown when a template cannot be filled for one row.
 */
public class FormFillException extends Exception {

    public FormFillException(String message) {
        super(message);
    }

    public FormFillException(String message, Throwable cause) {
        super(message, cause);
    }
}
