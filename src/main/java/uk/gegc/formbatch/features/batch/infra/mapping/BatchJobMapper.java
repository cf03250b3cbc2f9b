package uk.gegc.formbatch.features.batch.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.formbatch.features.batch.api.dto.BatchJobDto;
import uk.gegc.formbatch.features.batch.api.dto.BatchJobSummaryDto;
import uk.gegc.formbatch.features.batch.api.dto.RowOutcomeDto;
import uk.gegc.formbatch.features.batch.domain.model.BatchJob;
import uk.gegc.formbatch.features.batch.domain.model.RowOutcome;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface BatchJobMapper {

    BatchJobDto toDto(BatchJob job);

    BatchJobSummaryDto toSummary(BatchJob job);

    RowOutcomeDto toDto(RowOutcome outcome);
}
