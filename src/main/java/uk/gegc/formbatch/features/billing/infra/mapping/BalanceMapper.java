package uk.gegc.formbatch.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.formbatch.features.account.domain.model.Account;
import uk.gegc.formbatch.features.billing.api.dto.BalanceDto;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface BalanceMapper {

    @Mapping(target = "accountId", source = "id")
    @Mapping(target = "totalCredits", expression = "java(entity.totalCredits())")
    BalanceDto toDto(Account entity);
}
