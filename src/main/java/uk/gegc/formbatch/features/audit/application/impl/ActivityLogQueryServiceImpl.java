package uk.gegc.formbatch.features.audit.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.formbatch.features.audit.api.dto.ActivityLogEntryDto;
import uk.gegc.formbatch.features.audit.application.ActivityLogQueryService;
import uk.gegc.formbatch.features.audit.domain.repository.ActivityLogRepository;
import uk.gegc.formbatch.features.audit.infra.mapping.ActivityLogMapper;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ActivityLogQueryServiceImpl implements ActivityLogQueryService {

    private final ActivityLogRepository activityLogRepository;
    private final ActivityLogMapper activityLogMapper;

    @Override
    public Page<ActivityLogEntryDto> findForAccount(UUID accountId, Pageable pageable) {
        return activityLogRepository.findByTargetAccountIdOrderByCreatedAtDesc(accountId, pageable)
                .map(activityLogMapper::toDto);
    }

    @Override
    public List<ActivityLogEntryDto> findForJob(UUID jobId) {
        return activityLogMapper.toDtos(activityLogRepository.findByRelatedJobId(jobId));
    }
}
