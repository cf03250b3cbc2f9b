package uk.gegc.formbatch.features.limits.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.formbatch.features.limits.api.dto.TierDto;
import uk.gegc.formbatch.features.limits.domain.model.Tier;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface TierMapper {
    TierDto toDto(Tier entity);
    List<TierDto> toDtos(List<Tier> entities);
}
