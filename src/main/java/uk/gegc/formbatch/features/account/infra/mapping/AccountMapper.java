package uk.gegc.formbatch.features.account.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.mapstruct.ReportingPolicy;
import uk.gegc.formbatch.features.account.api.dto.AccountDto;
import uk.gegc.formbatch.features.account.domain.model.Account;
import uk.gegc.formbatch.features.limits.api.dto.CustomLimitsRequest;
import uk.gegc.formbatch.features.limits.domain.model.CustomLimits;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface AccountMapper {

    @Mapping(target = "customLimits", source = "customLimits", qualifiedByName = "overrideValues")
    @Mapping(target = "customLimitsReason", source = "customLimits.reason")
    AccountDto toDto(Account entity);

    @Named("overrideValues")
    default CustomLimitsRequest overrideValues(CustomLimits customLimits) {
        return CustomLimitsRequest.from(customLimits);
    }
}
