package uk.gegc.formbatch.features.batch.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Result of one CSV data row. Written once when the row finishes or is skipped.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class RowOutcome {

    @Column(name = "row_index", nullable = false)
    private int rowIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RowOutcomeStatus status;

    @Column(name = "output_file_name", length = 255)
    private String outputFileName;

    @Column(name = "output_ref", length = 255)
    private String outputRef;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    public static RowOutcome succeeded(int rowIndex, String outputFileName, String outputRef) {
        return new RowOutcome(rowIndex, RowOutcomeStatus.SUCCEEDED, outputFileName, outputRef, null);
    }

    public static RowOutcome failed(int rowIndex, String outputFileName, String errorMessage) {
        return new RowOutcome(rowIndex, RowOutcomeStatus.FAILED, outputFileName, null, truncate(errorMessage));
    }

    public static RowOutcome skipped(int rowIndex) {
        return new RowOutcome(rowIndex, RowOutcomeStatus.SKIPPED, null, null, "Skipped after cancellation");
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000);
    }
}
