package uk.gegc.formbatch.features.batch.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import uk.gegc.formbatch.features.account.domain.repository.AccountRepository;
import uk.gegc.formbatch.features.batch.api.dto.BatchJobDto;
import uk.gegc.formbatch.features.batch.api.dto.BatchJobSummaryDto;
import uk.gegc.formbatch.features.batch.application.BatchCancellationRegistry;
import uk.gegc.formbatch.features.batch.application.BatchJobService;
import uk.gegc.formbatch.features.batch.application.BatchMetricsService;
import uk.gegc.formbatch.features.batch.domain.events.BatchJobSubmittedEvent;
import uk.gegc.formbatch.features.batch.domain.exception.JobAlreadyFinishedException;
import uk.gegc.formbatch.features.batch.domain.model.BatchJob;
import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;
import uk.gegc.formbatch.features.batch.domain.repository.BatchJobRepository;
import uk.gegc.formbatch.features.batch.infra.mapping.BatchJobMapper;
import uk.gegc.formbatch.features.limits.application.LimitResolver;
import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;
import uk.gegc.formbatch.shared.security.AccessPolicy;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class BatchJobServiceImpl implements BatchJobService {

    private final BatchJobRepository jobRepository;
    private final AccountRepository accountRepository;
    private final LimitResolver limitResolver;
    private final BatchJobMapper jobMapper;
    private final BatchCancellationRegistry cancellationRegistry;
    private final BatchMetricsService metricsService;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public UUID submitBatch(UUID accountId, String templateRef, String dataRef, String templateFileName,
                            String idempotencyKey) {
        if (accountId == null) {
            throw new IllegalArgumentException("Account ID cannot be null");
        }
        if (templateRef == null || templateRef.isBlank()) {
            throw new IllegalArgumentException("Template reference is required");
        }
        if (dataRef == null || dataRef.isBlank()) {
            throw new IllegalArgumentException("Data reference is required");
        }

        String key = idempotencyKey != null && !idempotencyKey.isBlank() ? idempotencyKey.trim() : null;
        if (key != null) {
            // Keyed submissions for one account queue on the account row until the first one commits
            accountRepository.findByIdForUpdate(accountId)
                    .orElseThrow(() -> new ResourceNotFoundException("Account not found: " + accountId));
            var existing = jobRepository.findByAccountIdAndIdempotencyKey(accountId, key);
            if (existing.isPresent()) {
                log.info("Duplicate submission for account {} with key {} returns job {}",
                        accountId, key, existing.get().getId());
                return existing.get().getId();
            }
        }

        // Resolved now and frozen; later admin changes do not affect this job
        EffectiveLimits limits = limitResolver.resolve(accountId);

        BatchJob job = new BatchJob();
        job.setAccountId(accountId);
        job.setTemplateRef(templateRef);
        job.setDataRef(dataRef);
        job.setTemplateFileName(templateFileName);
        job.setIdempotencyKey(key);
        job.setStatus(BatchStatus.SUBMITTED);
        job.setLimits(limits);

        BatchJob saved = jobRepository.save(job);
        metricsService.incrementJobSubmitted();
        log.info("Submitted batch job {} for account {} (tier {}, template {})",
                saved.getId(), accountId, limits.getTierKey(), templateFileName);

        eventPublisher.publishEvent(new BatchJobSubmittedEvent(this, saved.getId()));
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public BatchJobDto getJobStatus(UUID jobId) {
        return jobRepository.findWithOutcomesById(jobId)
                .map(jobMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Batch job not found with ID: " + jobId));
    }

    @Override
    public void cancelJob(UUID jobId, UUID actorId) {
        BatchJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch job not found with ID: " + jobId));

        accessPolicy.requireOwnerOrAdmin(actorId, job.getAccountId());

        if (job.isTerminal()) {
            throw new JobAlreadyFinishedException("Job " + jobId + " already finished with status " + job.getStatus());
        }
        if (job.isCancelRequested()) {
            log.debug("Cancellation already requested for job {}", jobId);
            return;
        }

        jobRepository.flagCancelRequested(jobId);
        metricsService.incrementCancellationRequested();
        log.info("Cancellation requested for job {} by actor {}", jobId, actorId);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cancellationRegistry.requestCancel(jobId);
                }
            });
        } else {
            cancellationRegistry.requestCancel(jobId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Page<BatchJobSummaryDto> listJobs(UUID accountId, Pageable pageable) {
        return jobRepository.findByAccountIdOrderByCreatedAtDesc(accountId, pageable)
                .map(jobMapper::toSummary);
    }
}
