package uk.gegc.formbatch.features.limits.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.formbatch.features.limits.api.dto.TierDto;
import uk.gegc.formbatch.features.limits.application.TierCatalogService;
import uk.gegc.formbatch.features.limits.domain.repository.TierRepository;
import uk.gegc.formbatch.features.limits.infra.mapping.TierMapper;
import uk.gegc.formbatch.shared.exception.ResourceNotFoundException;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TierCatalogServiceImpl implements TierCatalogService {

    private final TierRepository tierRepository;
    private final TierMapper tierMapper;

    @Override
    public List<TierDto> listActiveTiers() {
        return tierMapper.toDtos(tierRepository.findAllByActiveTrueOrderByDisplayOrderAsc());
    }

    @Override
    public TierDto getTier(String tierKey) {
        return tierRepository.findByTierKey(tierKey)
                .map(tierMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Tier not found: " + tierKey));
    }
}
