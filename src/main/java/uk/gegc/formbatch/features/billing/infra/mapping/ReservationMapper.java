package uk.gegc.formbatch.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.formbatch.features.billing.api.dto.ReservationResult;
import uk.gegc.formbatch.features.billing.domain.model.Reservation;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ReservationMapper {

    @Mapping(target = "reservationId", source = "id")
    @Mapping(target = "monthlyReserved", source = "reserved.monthly")
    @Mapping(target = "rolloverReserved", source = "reserved.rollover")
    @Mapping(target = "topupReserved", source = "reserved.topup")
    ReservationResult toResult(Reservation entity);
}
