package uk.gegc.formbatch.features.batch.application;

import java.util.UUID;

/**
 * Drives one submitted job through validation, reservation, row processing, final charge
 * and packaging. Runs on the caller's thread.
 */
public interface BatchProcessor {

    /**
     * Processes the job if it is still {@code SUBMITTED}; any other state is left alone.
     * Never throws for job-level failures: they are recorded on the job.
     */
    void process(UUID jobId);

    /**
     * Fails a job that can no longer finish normally. Rows already recorded as succeeded are
     * billed; if that charge cannot be applied the reservation is left to expire.
     */
    void abandon(UUID jobId, String reason);
}
