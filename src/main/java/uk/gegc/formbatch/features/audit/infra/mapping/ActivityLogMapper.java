package uk.gegc.formbatch.features.audit.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.formbatch.features.audit.api.dto.ActivityLogEntryDto;
import uk.gegc.formbatch.features.audit.domain.model.ActivityLogEntry;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ActivityLogMapper {
    ActivityLogEntryDto toDto(ActivityLogEntry entity);
    List<ActivityLogEntryDto> toDtos(List<ActivityLogEntry> entities);
}
