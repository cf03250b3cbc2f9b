package uk.gegc.formbatch.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.formbatch.features.billing.api.dto.TransactionDto;
import uk.gegc.formbatch.features.billing.domain.model.CreditTransaction;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface CreditTransactionMapper {
    TransactionDto toDto(CreditTransaction entity);
    List<TransactionDto> toDtos(List<CreditTransaction> entities);
}
