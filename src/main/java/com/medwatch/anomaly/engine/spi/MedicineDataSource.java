package com.medwatch.anomaly.engine.spi;

import com.medwatch.anomaly.exception.DataFetchException;
import com.medwatch.anomaly.model.DataPoint;

import java.util.List;

/**
 * Supplies unprocessed medicine data points to the batch pipeline.
 */
public interface MedicineDataSource {

    /**
     * Fetch the next set of data points that have not been processed yet.
     *
     * @return pending data points, empty when there is nothing to do
     * @throws DataFetchException if the backing store cannot be read
     */
    List<DataPoint> fetchPendingDataPoints();

    /**
     * Mark data points as processed so later fetches skip them.
     * Called only after a batch got through detection.
     */
    void acknowledge(List<DataPoint> dataPoints);
}
