package uk.gegc.formbatch.features.batch.api.dto;

import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;
import uk.gegc.formbatch.features.batch.domain.model.FailureKind;
import uk.gegc.formbatch.features.batch.domain.model.LedgerState;
import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Full job view, including per-row outcomes in CSV order and live progress counters.
 */
public record BatchJobDto(
        UUID id,
        UUID accountId,
        String templateFileName,
        String idempotencyKey,
        BatchStatus status,
        EffectiveLimits limits,
        int totalRows,
        int processedRows,
        int succeededRows,
        int failedRows,
        int skippedRows,
        double progressPercentage,
        List<RowOutcomeDto> rowOutcomes,
        long estimatedCredits,
        long monthlyUsed,
        long rolloverUsed,
        long topupUsed,
        long totalUsed,
        UUID reservationId,
        LedgerState ledgerState,
        boolean cancelRequested,
        String outputRef,
        String outputFileName,
        Long outputSizeBytes,
        FailureKind failureKind,
        String errorMessage,
        String reconciliationNote,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        Long durationSeconds,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
