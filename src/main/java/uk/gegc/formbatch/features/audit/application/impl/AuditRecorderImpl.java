package uk.gegc.formbatch.features.audit.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.formbatch.features.audit.api.dto.AuditEntry;
import uk.gegc.formbatch.features.audit.application.AuditRecorder;
import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;
import uk.gegc.formbatch.features.audit.domain.repository.ActivityLogRepository;

import java.util.Map;

/**
 * Writes each entry in its own transaction so that a rollback of the caller does not
 * remove the record, and a failed insert does not roll back the caller.
 */
@Service
@Slf4j
public class AuditRecorderImpl implements AuditRecorder {

    static final String FALLBACK_LOGGER = "formbatch.audit.fallback";

    private static final Logger fallbackLog = LoggerFactory.getLogger(FALLBACK_LOGGER);
    private static final int MAX_DESCRIPTION_LENGTH = 1000;
    private static final int MAX_REASON_LENGTH = 500;

    private final ActivityLogRepository activityLogRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNewTemplate;

    public AuditRecorderImpl(ActivityLogRepository activityLogRepository,
                             ObjectMapper objectMapper,
                             PlatformTransactionManager transactionManager) {
        this.activityLogRepository = activityLogRepository;
        this.objectMapper = objectMapper;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void record(AuditEntry entry) {
        if (entry == null) {
            return;
        }
        try {
            ActivityLogEntry row = ActivityLogEntry.builder()
                    .category(entry.category())
                    .activityType(entry.activityType())
                    .actorType(entry.actorType())
                    .actorId(entry.actorId())
                    .targetAccountId(entry.targetAccountId())
                    .action(entry.action())
                    .description(truncate(entry.description(), MAX_DESCRIPTION_LENGTH))
                    .reason(truncate(entry.reason(), MAX_REASON_LENGTH))
                    .changesJson(toJson(entry.changes()))
                    .metadataJson(toJson(entry.metadata()))
                    .relatedJobId(entry.relatedJobId())
                    .relatedTierKey(entry.relatedTierKey())
                    .build();

            requiresNewTemplate.executeWithoutResult(status -> activityLogRepository.save(row));
            log.debug("Activity logged: {} for account {} by {} {}",
                    entry.activityType(), entry.targetAccountId(), entry.actorType(), entry.actorId());
        } catch (Exception e) {
            fallbackLog.error("Failed to write activity log entry type={} category={} account={} job={} description='{}' changes={}",
                    entry.activityType(), entry.category(), entry.targetAccountId(), entry.relatedJobId(),
                    entry.description(), entry.changes(), e);
        }
    }

    private String toJson(Map<String, Object> payload) throws JsonProcessingException {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        return objectMapper.writeValueAsString(payload);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
