package uk.gegc.formbatch.features.audit.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;

import java.util.List;
import java.util.UUID;

public interface ActivityLogRepository extends JpaRepository<ActivityLogEntry, UUID> {

    Page<ActivityLogEntry> findByTargetAccountIdOrderByCreatedAtDesc(UUID targetAccountId, Pageable pageable);

    Page<ActivityLogEntry> findByCategoryOrderByCreatedAtDesc(ActivityLogEntry.Category category, Pageable pageable);

    List<ActivityLogEntry> findByRelatedJobId(UUID relatedJobId);

    List<ActivityLogEntry> findByTargetAccountIdAndActivityType(UUID targetAccountId, ActivityLogEntry.ActivityType activityType);
}
