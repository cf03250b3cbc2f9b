package uk.gegc.formbatch.features.batch.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.formbatch.features.audit.api.dto.AuditEntry;
import uk.gegc.formbatch.features.audit.domain.events.ActivityRecordedEvent;
import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;
import uk.gegc.formbatch.features.batch.application.BatchCancellationRegistry;
import uk.gegc.formbatch.features.batch.application.BatchMetricsService;
import uk.gegc.formbatch.features.batch.application.BatchProcessor;
import uk.gegc.formbatch.features.batch.application.BatchProperties;
import uk.gegc.formbatch.features.batch.application.RowCostPolicy;
import uk.gegc.formbatch.features.batch.domain.events.BatchRowCompletedEvent;
import uk.gegc.formbatch.features.batch.domain.exception.BatchValidationException;
import uk.gegc.formbatch.features.batch.domain.model.BatchJob;
import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;
import uk.gegc.formbatch.features.batch.domain.model.FailureKind;
import uk.gegc.formbatch.features.batch.domain.model.LedgerState;
import uk.gegc.formbatch.features.batch.domain.model.RowOutcome;
import uk.gegc.formbatch.features.batch.domain.model.RowOutcomeStatus;
import uk.gegc.formbatch.features.batch.domain.repository.BatchJobRepository;
import uk.gegc.formbatch.features.billing.api.dto.CommitResult;
import uk.gegc.formbatch.features.billing.api.dto.ReservationResult;
import uk.gegc.formbatch.features.billing.application.CreditLedgerService;
import uk.gegc.formbatch.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.formbatch.features.billing.domain.exception.ReservationNotActiveException;
import uk.gegc.formbatch.features.billing.domain.model.ReservationState;
import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;
import uk.gegc.formbatch.features.packaging.application.OutputPackager;
import uk.gegc.formbatch.features.packaging.domain.exception.PackagingException;
import uk.gegc.formbatch.features.packaging.domain.model.PackageItem;
import uk.gegc.formbatch.features.packaging.domain.model.ZipArtifact;
import uk.gegc.formbatch.features.pdf.application.CsvDataReader;
import uk.gegc.formbatch.features.pdf.application.RowProcessor;
import uk.gegc.formbatch.features.pdf.domain.exception.CsvFormatException;
import uk.gegc.formbatch.features.pdf.domain.model.CsvData;
import uk.gegc.formbatch.features.pdf.domain.model.CsvRow;
import uk.gegc.formbatch.features.pdf.domain.model.RowResult;
import uk.gegc.formbatch.features.pdf.domain.model.TemplateSource;
import uk.gegc.formbatch.features.storage.application.FileStore;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;
import uk.gegc.formbatch.shared.util.FileSizeFormatter;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

@Service
@Slf4j
public class BatchProcessorImpl implements BatchProcessor {

    private static final String MDC_JOB_ID = "batch.jobId";
    private static final String MDC_ACCOUNT_ID = "batch.accountId";
    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final BatchJobRepository jobRepository;
    private final FileStore fileStore;
    private final CsvDataReader csvDataReader;
    private final RowProcessor rowProcessor;
    private final OutputPackager outputPackager;
    private final CreditLedgerService creditLedgerService;
    private final RowCostPolicy rowCostPolicy;
    private final BatchProperties batchProperties;
    private final BatchCancellationRegistry cancellationRegistry;
    private final BatchMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Executor rowTaskExecutor;

    public BatchProcessorImpl(BatchJobRepository jobRepository,
                              FileStore fileStore,
                              CsvDataReader csvDataReader,
                              RowProcessor rowProcessor,
                              OutputPackager outputPackager,
                              CreditLedgerService creditLedgerService,
                              RowCostPolicy rowCostPolicy,
                              BatchProperties batchProperties,
                              BatchCancellationRegistry cancellationRegistry,
                              BatchMetricsService metricsService,
                              ApplicationEventPublisher eventPublisher,
                              TransactionTemplate transactionTemplate,
                              Clock clock,
                              @Qualifier("rowTaskExecutor") Executor rowTaskExecutor) {
        this.jobRepository = jobRepository;
        this.fileStore = fileStore;
        this.csvDataReader = csvDataReader;
        this.rowProcessor = rowProcessor;
        this.outputPackager = outputPackager;
        this.creditLedgerService = creditLedgerService;
        this.rowCostPolicy = rowCostPolicy;
        this.batchProperties = batchProperties;
        this.cancellationRegistry = cancellationRegistry;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.rowTaskExecutor = rowTaskExecutor;
    }

    @Override
    public void process(UUID jobId) {
        MDC.put(MDC_JOB_ID, jobId.toString());
        try {
            BatchJob job = transactionTemplate.execute(status -> start(jobId));
            if (job == null) {
                return;
            }
            MDC.put(MDC_ACCOUNT_ID, job.getAccountId().toString());
            run(job);
        } catch (RuntimeException e) {
            log.error("Batch job {} aborted unexpectedly", jobId, e);
            abandon(jobId, "Processing failed: " + e.getMessage());
        } finally {
            cancellationRegistry.clear(jobId);
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_ACCOUNT_ID);
        }
    }

    private BatchJob start(UUID jobId) {
        BatchJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch job not found with ID: " + jobId));
        if (job.getStatus() != BatchStatus.SUBMITTED) {
            log.warn("Job {} is {}; not starting it again", jobId, job.getStatus());
            return null;
        }
        job.advanceTo(BatchStatus.VALIDATING);
        job.setStartedAt(LocalDateTime.now(clock));
        return jobRepository.save(job);
    }

    private void run(BatchJob job) {
        UUID jobId = job.getId();

        TemplateSource template;
        CsvData data;
        try {
            template = loadTemplate(job);
            data = loadData(job);
        } catch (BatchValidationException e) {
            log.info("Job {} rejected: {}", jobId, e.getMessage());
            finishFailed(jobId, FailureKind.VALIDATION, e.getMessage(), null);
            return;
        }

        int totalRows = data.rowCount();
        long estimate = rowCostPolicy.estimate(job, totalRows);
        inTransaction(jobId, j -> {
            j.advanceTo(BatchStatus.RESERVING);
            j.setTotalRows(totalRows);
            j.setEstimatedCredits(estimate);
        });

        ReservationResult reservation;
        try {
            reservation = creditLedgerService.reserve(job.getAccountId(), estimate, jobId);
        } catch (InsufficientCreditsException e) {
            log.info("Job {} cannot start: {}", jobId, e.getMessage());
            finishFailed(jobId, FailureKind.INSUFFICIENT_CREDITS, e.getMessage(), null);
            return;
        }

        boolean cancelledBeforeStart = Boolean.TRUE.equals(transactionTemplate.execute(status -> {
            BatchJob j = load(jobId);
            j.setReservationId(reservation.reservationId());
            j.setLedgerState(LedgerState.RESERVED);
            j.advanceTo(BatchStatus.PROCESSING);
            jobRepository.save(j);
            return j.isCancelRequested();
        }));

        log.info("Processing {} rows for job {} with up to {} in parallel ({} credits reserved)",
                totalRows, jobId, batchProperties.getMaxParallelRows(), estimate);

        RowOutcome[] outcomes = processRows(jobId, reservation.reservationId(), template, data, cancelledBeforeStart);
        int succeeded = 0;
        boolean cancelled = false;
        for (RowOutcome outcome : outcomes) {
            if (outcome.getStatus() == RowOutcomeStatus.SUCCEEDED) {
                succeeded++;
            } else if (outcome.getStatus() == RowOutcomeStatus.SKIPPED) {
                cancelled = true;
            }
        }

        String ledgerNote = settleCharge(job, reservation.reservationId(), succeeded);

        if (succeeded == 0) {
            FailureKind kind = cancelled ? FailureKind.CANCELLED : FailureKind.NO_ROWS_SUCCEEDED;
            String message = cancelled
                    ? "Job was cancelled before any PDF was generated"
                    : "No PDFs were generated: all " + totalRows + " rows failed";
            finishFailed(jobId, kind, message, ledgerNote);
            return;
        }

        inTransaction(jobId, j -> j.advanceTo(BatchStatus.PACKAGING));

        List<PackageItem> items = new ArrayList<>();
        for (RowOutcome outcome : outcomes) {
            if (outcome.getStatus() == RowOutcomeStatus.SUCCEEDED) {
                items.add(new PackageItem(outcome.getOutputFileName(), outcome.getOutputRef()));
            }
        }

        ZipArtifact archive;
        try {
            archive = outputPackager.pack(jobId, job.getTemplateFileName(), items);
        } catch (PackagingException e) {
            log.error("Packaging failed for job {}", jobId, e);
            String note = succeeded + " PDFs were generated and charged but could not be packaged: " + e.getMessage()
                    + (ledgerNote != null ? " " + ledgerNote : "");
            finishFailed(jobId, FailureKind.PACKAGING,
                    "Your PDFs were generated but could not be packaged into a ZIP file", note);
            return;
        }

        BatchStatus terminal = succeeded == totalRows ? BatchStatus.COMPLETED : BatchStatus.PARTIALLY_COMPLETED;
        finishSucceeded(jobId, terminal, archive, ledgerNote);
    }

    private TemplateSource loadTemplate(BatchJob job) {
        EffectiveLimits limits = job.getLimits();
        long size = sizeOf(job.getTemplateRef(), "Template");
        checkSize(size, limits.getMaxTemplateFileBytes(), "Template");

        byte[] content = readFile(job.getTemplateRef(), "Template");
        if (!startsWith(content, PDF_MAGIC)) {
            throw new BatchValidationException("Template file is not a PDF document");
        }
        return new TemplateSource(job.getTemplateRef(), job.getTemplateFileName(), content);
    }

    private CsvData loadData(BatchJob job) {
        EffectiveLimits limits = job.getLimits();
        long size = sizeOf(job.getDataRef(), "Data");
        checkSize(size, limits.getMaxDataFileBytes(), "Data");

        CsvData data;
        try {
            data = csvDataReader.read(readFile(job.getDataRef(), "Data"));
        } catch (CsvFormatException e) {
            throw new BatchValidationException("Data file could not be read as CSV: " + e.getMessage());
        }
        if (data.rowCount() == 0) {
            throw new BatchValidationException("Data file contains no data rows");
        }
        if (data.rowCount() > limits.getMaxRowsPerBatch()) {
            throw new BatchValidationException("Data file has " + data.rowCount() + " rows, which exceeds the maximum of "
                    + limits.getMaxRowsPerBatch() + " rows per batch for your account tier");
        }
        return data;
    }

    private long sizeOf(String ref, String fileType) {
        try {
            return fileStore.size(ref);
        } catch (ResourceNotFoundException e) {
            throw new BatchValidationException(fileType + " file not found");
        }
    }

    private byte[] readFile(String ref, String fileType) {
        try {
            return fileStore.read(ref);
        } catch (ResourceNotFoundException e) {
            throw new BatchValidationException(fileType + " file not found");
        }
    }

    private static void checkSize(long size, long maxSize, String fileType) {
        if (size > maxSize) {
            throw new BatchValidationException(fileType + " file size (" + FileSizeFormatter.format(size)
                    + ") exceeds the maximum allowed size of " + FileSizeFormatter.format(maxSize)
                    + " for your account tier");
        }
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Dispatches rows in CSV order with at most {@code maxParallelRows} in flight and stores
     * each outcome as it arrives. Cancellation is checked before every dispatch; rows not yet
     * dispatched at that point are recorded as skipped. The credit hold is kept alive while
     * rows keep completing.
     */
    private RowOutcome[] processRows(UUID jobId, UUID reservationId, TemplateSource template, CsvData data,
                                     boolean cancelledBeforeStart) {
        List<CsvRow> rows = data.rows();
        RowOutcome[] outcomes = new RowOutcome[rows.size()];
        int maxInFlight = batchProperties.getMaxParallelRows();

        CompletionService<RowResult> completion = new ExecutorCompletionService<>(rowTaskExecutor);
        Map<Future<RowResult>, Integer> inFlight = new HashMap<>();
        Map<String, String> mdcContext = MDC.getCopyOfContextMap();

        boolean cancelled = cancelledBeforeStart;
        int next = 0;
        while (next < rows.size() || !inFlight.isEmpty()) {
            while (!cancelled && next < rows.size() && inFlight.size() < maxInFlight) {
                cancelled = cancellationRegistry.isCancelRequested(jobId);
                if (cancelled) {
                    break;
                }
                CsvRow row = rows.get(next);
                Future<RowResult> future = completion.submit(() -> processWithContext(template, row, mdcContext));
                inFlight.put(future, row.rowIndex());
                next++;
            }

            if (cancelled && next < rows.size()) {
                log.info("Job {} cancelled; skipping rows {} to {}", jobId, next + 1, rows.size());
                recordSkipped(jobId, next, rows.size(), outcomes);
                next = rows.size();
            }
            if (inFlight.isEmpty()) {
                break;
            }

            Future<RowResult> done;
            try {
                done = completion.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for rows of job " + jobId, e);
            }
            int rowIndex = inFlight.remove(done);
            RowOutcome outcome = toOutcome(rowIndex, done);
            outcomes[rowIndex] = outcome;
            if (recordOutcome(jobId, outcome, rows.size())) {
                cancelled = true;
            }
            keepReservationAlive(jobId, reservationId);
        }
        return outcomes;
    }

    private void keepReservationAlive(UUID jobId, UUID reservationId) {
        try {
            if (!creditLedgerService.extendReservation(reservationId)) {
                log.warn("Reservation {} for job {} is no longer active; the final charge will be reconciled",
                        reservationId, jobId);
            }
        } catch (RuntimeException e) {
            log.error("Could not extend reservation {} for job {}", reservationId, jobId, e);
        }
    }

    private RowResult processWithContext(TemplateSource template, CsvRow row, Map<String, String> mdcContext) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdcContext != null) {
            MDC.setContextMap(mdcContext);
        }
        try {
            return rowProcessor.process(template, row);
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private RowOutcome toOutcome(int rowIndex, Future<RowResult> done) {
        try {
            RowResult result = done.get();
            return result.succeeded()
                    ? RowOutcome.succeeded(rowIndex, result.outputFileName(), result.outputRef())
                    : RowOutcome.failed(rowIndex, result.outputFileName(), result.errorMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Row {} failed unexpectedly", rowIndex + 1, cause);
            return RowOutcome.failed(rowIndex, null, "Error processing row " + (rowIndex + 1) + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RowOutcome.failed(rowIndex, null, "Row processing interrupted");
        }
    }

    /**
     * @return whether cancellation has been requested for the job
     */
    private boolean recordOutcome(UUID jobId, RowOutcome outcome, int totalRows) {
        RowProgress progress = transactionTemplate.execute(status -> {
            BatchJob job = load(jobId);
            job.recordOutcome(outcome);
            jobRepository.save(job);
            return new RowProgress(job.getProcessedRows(), job.isCancelRequested());
        });
        eventPublisher.publishEvent(new BatchRowCompletedEvent(this, jobId, outcome.getRowIndex(),
                outcome.getStatus(), progress.processedRows(), totalRows));
        return progress.cancelRequested();
    }

    private void recordSkipped(UUID jobId, int fromIndex, int toIndex, RowOutcome[] outcomes) {
        int processed = transactionTemplate.execute(status -> {
            BatchJob job = load(jobId);
            for (int i = fromIndex; i < toIndex; i++) {
                RowOutcome skipped = RowOutcome.skipped(i);
                outcomes[i] = skipped;
                job.recordOutcome(skipped);
            }
            jobRepository.save(job);
            return job.getProcessedRows();
        });
        for (int i = fromIndex; i < toIndex; i++) {
            eventPublisher.publishEvent(new BatchRowCompletedEvent(this, jobId, i, RowOutcomeStatus.SKIPPED,
                    processed, outcomes.length));
        }
    }

    /**
     * Commits the reservation at the price of the rows that succeeded.
     *
     * @return a reconciliation note when the charge could not be applied as computed
     */
    private String settleCharge(BatchJob job, UUID reservationId, int succeeded) {
        long charge = rowCostPolicy.charge(job, succeeded);
        CommitResult result;
        try {
            result = creditLedgerService.commit(reservationId, charge);
        } catch (ReservationNotActiveException e) {
            log.warn("Reservation {} for job {} was no longer active at final charge: {}",
                    reservationId, job.getId(), e.getMessage());
            inTransaction(job.getId(), j -> j.setLedgerState(LedgerState.RELEASED));
            return "The credit reservation was no longer active at final charge (" + e.getMessage()
                    + "); no credits were charged for this job";
        }

        inTransaction(job.getId(), j -> {
            j.setMonthlyUsed(result.monthlyCharged());
            j.setRolloverUsed(result.rolloverCharged());
            j.setTopupUsed(result.topupCharged());
            j.setTotalUsed(result.committedCredits());
            j.setLedgerState(result.state() == ReservationState.COMMITTED ? LedgerState.COMMITTED : LedgerState.RELEASED);
        });
        log.info("Job {} charged {} credits ({} refunded)", job.getId(), result.committedCredits(), result.refundedCredits());
        return null;
    }

    private void finishSucceeded(UUID jobId, BatchStatus terminal, ZipArtifact archive, String note) {
        BatchJob finished = transactionTemplate.execute(status -> {
            BatchJob job = load(jobId);
            job.setOutputRef(archive.ref());
            job.setOutputFileName(archive.fileName());
            job.setOutputSizeBytes(archive.sizeBytes());
            if (note != null) {
                job.setReconciliationNote(note);
            }
            job.markFinished(terminal, LocalDateTime.now(clock));
            BatchJob saved = jobRepository.save(job);
            publishTerminalAudit(saved);
            return saved;
        });
        metricsService.incrementJobFinished(terminal, null);
        log.info("Job {} finished {}: {} of {} rows succeeded, output {}",
                jobId, terminal, finished.getSucceededRows(), finished.getTotalRows(), archive.fileName());
    }

    private void finishFailed(UUID jobId, FailureKind kind, String message, String note) {
        transactionTemplate.executeWithoutResult(status -> {
            BatchJob job = load(jobId);
            if (note != null) {
                job.setReconciliationNote(note);
            }
            job.markFailed(kind, message, LocalDateTime.now(clock));
            publishTerminalAudit(jobRepository.save(job));
        });
        metricsService.incrementJobFinished(BatchStatus.FAILED, kind);
        log.info("Job {} failed ({}): {}", jobId, kind, message);
    }

    @Override
    public void abandon(UUID jobId, String reason) {
        try {
            BatchJob job = jobRepository.findById(jobId).orElse(null);
            if (job == null || job.isTerminal()) {
                return;
            }
            String note = null;
            if (job.getLedgerState() == LedgerState.RESERVED && job.getReservationId() != null) {
                try {
                    note = settleCharge(job, job.getReservationId(), job.getSucceededRows());
                } catch (RuntimeException ledgerError) {
                    log.error("Could not settle reservation {} for job {}", job.getReservationId(), jobId, ledgerError);
                    note = "Final charge could not be recorded; the reservation will be released when it expires";
                }
            }
            finishFailed(jobId, FailureKind.INTERNAL, reason, note);
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}", jobId, e);
        }
    }

    private void publishTerminalAudit(BatchJob job) {
        ActivityLogEntry.ActivityType type = switch (job.getStatus()) {
            case COMPLETED -> ActivityLogEntry.ActivityType.JOB_COMPLETED;
            case PARTIALLY_COMPLETED -> ActivityLogEntry.ActivityType.JOB_PARTIALLY_COMPLETED;
            default -> ActivityLogEntry.ActivityType.JOB_FAILED;
        };

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("totalRows", job.getTotalRows());
        metadata.put("succeededRows", job.getSucceededRows());
        metadata.put("failedRows", job.getFailedRows());
        metadata.put("skippedRows", job.getSkippedRows());
        metadata.put("creditsCharged", job.getTotalUsed());
        metadata.put("cancelRequested", job.isCancelRequested());
        if (job.getFailureKind() != null) {
            metadata.put("failureKind", job.getFailureKind().name());
        }
        if (job.getOutputFileName() != null) {
            metadata.put("outputFileName", job.getOutputFileName());
        }

        String description = job.getFailureKind() != null
                ? "Batch job failed: " + job.getErrorMessage()
                : "Batch job " + job.getStatus().name().toLowerCase() + ": " + job.getSucceededRows()
                  + " of " + job.getTotalRows() + " PDFs generated";

        eventPublisher.publishEvent(new ActivityRecordedEvent(this, AuditEntry.builder()
                .category(ActivityLogEntry.Category.JOB)
                .activityType(type)
                .actorType(ActivityLogEntry.ActorType.ACCOUNT)
                .actorId(job.getAccountId())
                .targetAccountId(job.getAccountId())
                .action("batch_job_" + job.getStatus().name().toLowerCase())
                .description(description)
                .reason(job.getReconciliationNote())
                .metadata(metadata)
                .relatedJobId(job.getId())
                .relatedTierKey(job.getLimits() != null ? job.getLimits().getTierKey() : null)
                .build()));
    }

    private void inTransaction(UUID jobId, Consumer<BatchJob> change) {
        transactionTemplate.executeWithoutResult(status -> {
            BatchJob job = load(jobId);
            change.accept(job);
            jobRepository.save(job);
        });
    }

    private BatchJob load(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch job not found with ID: " + jobId));
    }

    private record RowProgress(int processedRows, boolean cancelRequested) {
    }
}
