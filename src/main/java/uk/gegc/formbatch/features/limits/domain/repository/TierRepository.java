package uk.gegc.formbatch.features.limits.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.formbatch.features.limits.domain.model.Tier;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TierRepository extends JpaRepository<Tier, UUID> {

    Optional<Tier> findByTierKey(String tierKey);

    Optional<Tier> findByTierKeyAndActiveTrue(String tierKey);

    boolean existsByTierKey(String tierKey);

    List<Tier> findAllByActiveTrueOrderByDisplayOrderAsc();
}
