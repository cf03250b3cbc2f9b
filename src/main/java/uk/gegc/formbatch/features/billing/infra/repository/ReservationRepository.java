package uk.gegc.formbatch.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.formbatch.features.billing.domain.model.Reservation;
import uk.gegc.formbatch.features.billing.domain.model.ReservationState;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReservationRepository extends JpaRepository<Reservation, UUID> {

    Optional<Reservation> findByJobId(UUID jobId);

    List<Reservation> findByAccountIdAndState(UUID accountId, ReservationState state);

    @Query("SELECT r.id FROM Reservation r WHERE r.state = :state AND r.expiresAt < :cutoff")
    List<UUID> findIdsByStateAndExpiresAtBefore(@Param("state") ReservationState state,
                                                @Param("cutoff") LocalDateTime cutoff);
}
