package uk.gegc.formbatch.repository.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.formbatch.features.batch.domain.model.BatchJob;
import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;
import uk.gegc.formbatch.features.batch.domain.model.RowOutcome;
import uk.gegc.formbatch.features.batch.domain.repository.BatchJobRepository;
import uk.gegc.formbatch.features.limits.domain.model.EffectiveLimits;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class BatchJobRepositoryTest {

    @Autowired
    private BatchJobRepository jobRepository;

    @Autowired
    private TestEntityManager entityManager;

    private BatchJob persistJob(UUID accountId, BatchStatus status, String idempotencyKey) {
        BatchJob job = new BatchJob();
        job.setAccountId(accountId);
        job.setTemplateRef("template-ref");
        job.setDataRef("data-ref");
        job.setTemplateFileName("Form.pdf");
        job.setIdempotencyKey(idempotencyKey);
        job.setStatus(status);
        job.setLimits(EffectiveLimits.builder()
                .tierKey("standard")
                .maxTemplateFileBytes(5_000_000L)
                .maxDataFileBytes(1_000_000L)
                .maxRowsPerBatch(100)
                .maxSavedTemplates(5)
                .maxTotalStorageMb(100L)
                .build());
        entityManager.persist(job);
        entityManager.flush();
        return job;
    }

    @Test
    @DisplayName("flagCancelRequested sets the flag once without bumping the version")
    void flagCancelRequested_SetsFlagOnce() {
        BatchJob job = persistJob(UUID.randomUUID(), BatchStatus.PROCESSING, null);
        long versionBefore = job.getVersion();

        assertEquals(1, jobRepository.flagCancelRequested(job.getId()));
        assertEquals(0, jobRepository.flagCancelRequested(job.getId()));
        entityManager.clear();

        BatchJob reloaded = entityManager.find(BatchJob.class, job.getId());
        assertTrue(reloaded.isCancelRequested());
        assertEquals(versionBefore, reloaded.getVersion());
    }

    @Test
    @DisplayName("findByStatusInAndUpdatedAtBefore returns only active jobs past the cutoff")
    void findStale_ReturnsOldActiveJobs() {
        BatchJob stuck = persistJob(UUID.randomUUID(), BatchStatus.PROCESSING, null);
        BatchJob finished = persistJob(UUID.randomUUID(), BatchStatus.COMPLETED, null);
        BatchJob fresh = persistJob(UUID.randomUUID(), BatchStatus.PROCESSING, null);

        LocalDateTime threeHoursAgo = LocalDateTime.now().minusHours(3);
        entityManager.getEntityManager()
                .createQuery("UPDATE BatchJob j SET j.updatedAt = :at WHERE j.id IN :ids")
                .setParameter("at", threeHoursAgo)
                .setParameter("ids", List.of(stuck.getId(), finished.getId()))
                .executeUpdate();
        entityManager.clear();

        List<BatchJob> stale = jobRepository.findByStatusInAndUpdatedAtBefore(
                EnumSet.of(BatchStatus.SUBMITTED, BatchStatus.PROCESSING), LocalDateTime.now().minusHours(2));

        assertEquals(1, stale.size());
        assertEquals(stuck.getId(), stale.get(0).getId());
        assertNotEquals(fresh.getId(), stale.get(0).getId());
    }

    @Test
    @DisplayName("findByAccountIdAndIdempotencyKey is scoped to the account")
    void findByIdempotencyKey_ScopedToAccount() {
        UUID accountId = UUID.randomUUID();
        BatchJob job = persistJob(accountId, BatchStatus.SUBMITTED, "upload-7");

        Optional<BatchJob> same = jobRepository.findByAccountIdAndIdempotencyKey(accountId, "upload-7");
        Optional<BatchJob> other = jobRepository.findByAccountIdAndIdempotencyKey(UUID.randomUUID(), "upload-7");

        assertTrue(same.isPresent());
        assertEquals(job.getId(), same.get().getId());
        assertFalse(other.isPresent());
    }

    @Test
    @DisplayName("findWithOutcomesById loads outcomes in row order")
    void findWithOutcomes_OrderedByRowIndex() {
        BatchJob job = persistJob(UUID.randomUUID(), BatchStatus.PROCESSING, null);
        job.recordOutcome(RowOutcome.succeeded(2, "c.pdf", "ref-c"));
        job.recordOutcome(RowOutcome.failed(0, "a.pdf", "Error processing row 1: bad value"));
        job.recordOutcome(RowOutcome.succeeded(1, "b.pdf", "ref-b"));
        entityManager.flush();
        entityManager.clear();

        BatchJob loaded = jobRepository.findWithOutcomesById(job.getId()).orElseThrow();

        assertEquals(List.of(0, 1, 2), loaded.getRowOutcomes().stream().map(RowOutcome::getRowIndex).toList());
        assertEquals(3, loaded.getProcessedRows());
        assertEquals(1, loaded.getFailedRows());
    }
}
