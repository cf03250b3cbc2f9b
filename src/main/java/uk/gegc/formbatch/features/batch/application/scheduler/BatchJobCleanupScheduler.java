package uk.gegc.formbatch.features.batch.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.formbatch.features.batch.application.BatchProcessor;
import uk.gegc.formbatch.features.batch.application.BatchProperties;
import uk.gegc.formbatch.features.batch.domain.model.BatchJob;
import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;
import uk.gegc.formbatch.features.batch.domain.repository.BatchJobRepository;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Fails jobs that stopped making progress, e.g. after a restart interrupted their
 * processing thread, so their reservations are settled instead of waiting for expiry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchJobCleanupScheduler {

    private static final EnumSet<BatchStatus> ACTIVE_STATUSES = EnumSet.of(
            BatchStatus.SUBMITTED, BatchStatus.VALIDATING, BatchStatus.RESERVING,
            BatchStatus.PROCESSING, BatchStatus.PACKAGING);

    private final BatchJobRepository jobRepository;
    private final BatchProcessor batchProcessor;
    private final BatchProperties batchProperties;

    @Scheduled(fixedDelayString = "${formbatch.batch.cleanup-fixed-delay-ms:300000}")
    public void cleanupStaleJobs() {
        log.debug("Running scheduled cleanup of stale batch jobs");
        try {
            failStaleJobs();
        } catch (Exception e) {
            log.error("Error during scheduled cleanup of stale batch jobs", e);
        }
    }

    /**
     * @return number of jobs failed by this run
     */
    public int failStaleJobs() {
        long timeoutMinutes = batchProperties.getStaleJobTimeoutMinutes();
        // updatedAt is stamped by the entity callbacks in the JVM zone
        LocalDateTime cutoff = LocalDateTime.now().minusMinutes(timeoutMinutes);
        List<UUID> staleIds = jobRepository.findByStatusInAndUpdatedAtBefore(ACTIVE_STATUSES, cutoff).stream()
                .map(BatchJob::getId)
                .toList();
        if (staleIds.isEmpty()) {
            return 0;
        }
        log.warn("Failing {} batch jobs with no progress for {} minutes", staleIds.size(), timeoutMinutes);
        for (UUID jobId : staleIds) {
            batchProcessor.abandon(jobId, "Job did not finish within " + timeoutMinutes + " minutes");
        }
        return staleIds.size();
    }
}
