package uk.gegc.formbatch.features.batch.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.formbatch.features.batch.domain.model.BatchJob;
import uk.gegc.formbatch.features.batch.domain.model.BatchStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BatchJobRepository extends JpaRepository<BatchJob, UUID> {

    Optional<BatchJob> findByAccountIdAndIdempotencyKey(UUID accountId, String idempotencyKey);

    @EntityGraph(attributePaths = "rowOutcomes")
    @Query("SELECT j FROM BatchJob j WHERE j.id = :id")
    Optional<BatchJob> findWithOutcomesById(@Param("id") UUID id);

    Page<BatchJob> findByAccountIdOrderByCreatedAtDesc(UUID accountId, Pageable pageable);

    List<BatchJob> findByStatusInAndUpdatedAtBefore(Collection<BatchStatus> statuses, LocalDateTime cutoff);

    /**
     * Sets the cancellation flag without touching the version, so it never conflicts with
     * the processing thread's own updates.
     */
    @Modifying
    @Query("UPDATE BatchJob j SET j.cancelRequested = true WHERE j.id = :id AND j.cancelRequested = false")
    int flagCancelRequested(@Param("id") UUID id);
}
