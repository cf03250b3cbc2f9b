package uk.gegc.formbatch.features.batch.domain.events;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a batch job has been stored. Handled after the surrounding transaction
 * commits so the processing thread can see the job.
 */
public class BatchJobSubmittedEvent extends ApplicationEvent {

    private final UUID jobId;

    public BatchJobSubmittedEvent(Object source, UUID jobId) {
        super(source);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
