package uk.gegc.formbatch.features.billing.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.formbatch.features.billing.domain.model.CreditTransaction;
import uk.gegc.formbatch.features.billing.domain.model.CreditTransactionType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {

    Optional<CreditTransaction> findByIdempotencyKey(String idempotencyKey);

    List<CreditTransaction> findByReservationIdOrderByCreatedAtAsc(UUID reservationId);

    List<CreditTransaction> findByAccountIdAndType(UUID accountId, CreditTransactionType type);

    Page<CreditTransaction> findByAccountIdOrderByCreatedAtDesc(UUID accountId, Pageable pageable);
}
