package uk.gegc.formbatch.features.pdf.domain.model;

/**
 * Result of filling one row: either a stored artifact or an error message.
 */
public record RowResult(
        int rowIndex,
        boolean succeeded,
        String outputFileName,
        String outputRef,
        String errorMessage
) {

    public static RowResult success(int rowIndex, String outputFileName, String outputRef) {
        return new RowResult(rowIndex, true, outputFileName, outputRef, null);
    }

    public static RowResult failure(int rowIndex, String outputFileName, String errorMessage) {
        return new RowResult(rowIndex, false, outputFileName, null, errorMessage);
    }
}
