package uk.gegc.formbatch.features.batch.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.formbatch.features.batch.api.dto.BatchJobDto;
import uk.gegc.formbatch.features.batch.api.dto.BatchJobSummaryDto;

import java.util.UUID;

/**
 * Entry point for batch jobs. Processing runs asynchronously; callers poll
 * {@link #getJobStatus} for progress.
 */
public interface BatchJobService {

    /**
     * Stores a job for the given uploaded template and CSV and schedules it.
     *
     * @param templateFileName original template name, used to name the output archive
     * @param idempotencyKey   optional; a repeated submission with the same key for the
     *                         same account returns the first job's id and starts nothing
     * @return the job id
     */
    UUID submitBatch(UUID accountId, String templateRef, String dataRef, String templateFileName, String idempotencyKey);

    BatchJobDto getJobStatus(UUID jobId);

    /**
     * Asks a running job to stop. Rows already in flight finish and are billed; rows not yet
     * started are recorded as skipped.
     */
    void cancelJob(UUID jobId, UUID actorId);

    Page<BatchJobSummaryDto> listJobs(UUID accountId, Pageable pageable);
}
