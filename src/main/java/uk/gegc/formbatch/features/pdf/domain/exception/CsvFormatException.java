package uk.gegc.formbatch.features.pdf.domain.exception;

public class CsvFormatException extends RuntimeException {

    public CsvFormatException(String message) {
        super(message);
    }
}
