package uk.gegc.formbatch.features.batch.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.formbatch.features.batch.application.BatchProperties;
import uk.gegc.formbatch.features.batch.application.RowCostPolicy;
import uk.gegc.formbatch.features.batch.domain.model.BatchJob;

@Component
@RequiredArgsConstructor
public class FlatRowCostPolicy implements RowCostPolicy {

    private final BatchProperties batchProperties;

    @Override
    public long perRowCost(BatchJob job) {
        return batchProperties.getCreditsPerRow();
    }
}
