package uk.gegc.formbatch.features.batch.api.dto;

import uk.gegc.formbatch.features.batch.domain.model.RowOutcomeStatus;

public record RowOutcomeDto(
        int rowIndex,
        RowOutcomeStatus status,
        String outputFileName,
        String outputRef,
        String errorMessage
) {
}
