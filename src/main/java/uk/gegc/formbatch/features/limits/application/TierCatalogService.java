package uk.gegc.formbatch.features.limits.application;

import uk.gegc.formbatch.features.limits.api.dto.TierDto;

import java.util.List;

public interface TierCatalogService {

    List<TierDto> listActiveTiers();

    TierDto getTier(String tierKey);
}
