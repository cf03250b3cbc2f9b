package uk.gegc.formbatch.features.batch.application;

import uk.gegc.formbatch.features.batch.domain.model.BatchJob;

/**
 * Prices a batch. The orchestrator reserves {@link #estimate} up front and charges
 * {@link #charge} once the rows are done.
 */
public interface RowCostPolicy {

    long perRowCost(BatchJob job);

    default long estimate(BatchJob job, int rowCount) {
        return perRowCost(job) * rowCount;
    }

    default long charge(BatchJob job, int succeededRows) {
        return perRowCost(job) * succeededRows;
    }
}
