package uk.gegc.formbatch.features.batch.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.formbatch.features.batch.application.BatchMetricsService;
import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;
import uk.gegc.formbatch.features.batch.domain.model.FailureKind;
import uk.gegc.formbatch.features.batch.domain.model.RowOutcomeStatus;

@Service
public class BatchMetricsServiceImpl implements BatchMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter jobsSubmittedCounter;
    private final Counter cancellationsCounter;

    public BatchMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.jobsSubmittedCounter = Counter.builder("batch.jobs.submitted")
                .description("Batch jobs accepted for processing")
                .register(meterRegistry);
        this.cancellationsCounter = Counter.builder("batch.jobs.cancel_requested")
                .description("Cancellation requests accepted")
                .register(meterRegistry);
    }

    @Override
    public void incrementJobSubmitted() {
        jobsSubmittedCounter.increment();
    }

    @Override
    public void incrementJobFinished(BatchStatus status, FailureKind failureKind) {
        Counter.builder("batch.jobs.finished")
                .description("Batch jobs reaching a terminal status")
                .tag("status", status.name())
                .tag("failureKind", failureKind != null ? failureKind.name() : "NONE")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementRowOutcome(RowOutcomeStatus status) {
        Counter.builder("batch.rows.processed")
                .description("Rows finished, by outcome")
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementCancellationRequested() {
        cancellationsCounter.increment();
    }
}
