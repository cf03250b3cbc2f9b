package uk.gegc.formbatch.features.batch.api.dto;

import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;
import uk.gegc.formbatch.features.batch.domain.model.FailureKind;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Processing history entry.
 */
public record BatchJobSummaryDto(
        UUID id,
        String templateFileName,
        BatchStatus status,
        int totalRows,
        int succeededRows,
        int failedRows,
        int skippedRows,
        long totalUsed,
        String outputFileName,
        Long outputSizeBytes,
        FailureKind failureKind,
        LocalDateTime createdAt,
        LocalDateTime completedAt
) {
}
