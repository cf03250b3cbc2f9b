package uk.gegc.formbatch.features.audit.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.formbatch.features.audit.api.dto.ActivityLogEntryDto;

import java.util.List;
import java.util.UUID;

public interface ActivityLogQueryService {

    Page<ActivityLogEntryDto> findForAccount(UUID accountId, Pageable pageable);

    List<ActivityLogEntryDto> findForJob(UUID jobId);
}
