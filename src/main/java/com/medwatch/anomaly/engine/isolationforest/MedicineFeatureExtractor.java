package com.medwatch.anomaly.engine.isolationforest;

import com.medwatch.anomaly.model.DataPoint;

import java.util.List;

/**
 * Turns a preprocessed data point into the 6-dimensional vector the isolation forest is trained on.
 *
 * Features:
 *   [0] Stock ratio: currentStock / criticalThreshold (1.0 when no threshold is set)
 *   [1] Price ratio: currentPrice / averageMarketPrice (1.0 when no market price is known)
 *   [2] Days of cover, capped at 365 (365 when consumption is unknown)
 *   [3] Relative decline: declineRate / dailyConsumption (0.0 when either is unknown)
 *   [4] Price volatility: coefficient of variation of the price history
 *   [5] Supplier delay in days
 */
public final class MedicineFeatureExtractor {

    public static final int FEATURE_COUNT = 6;

    public static final String[] FEATURE_NAMES = {
            "Stock Ratio",
            "Price Ratio",
            "Days of Cover",
            "Relative Decline",
            "Price Volatility",
            "Supplier Delay"
    };

    static final double MAX_DAYS_OF_COVER = 365.0;

    private MedicineFeatureExtractor() {}

    public static double[] extract(DataPoint dataPoint) {
        double[] features = new double[FEATURE_COUNT];

        features[0] = dataPoint.getCriticalThreshold() > 0
                ? dataPoint.getCurrentStock() / (double) dataPoint.getCriticalThreshold()
                : 1.0;

        features[1] = dataPoint.getAverageMarketPrice() > 0
                ? dataPoint.getCurrentPrice() / dataPoint.getAverageMarketPrice()
                : 1.0;

        Double daysOfCover = dataPoint.getDaysOfCover();
        features[2] = daysOfCover != null ? Math.min(daysOfCover, MAX_DAYS_OF_COVER) : MAX_DAYS_OF_COVER;

        Double declineRate = dataPoint.getCurrentDeclineRate();
        features[3] = declineRate != null && dataPoint.getDailyConsumption() > 0
                ? declineRate / dataPoint.getDailyConsumption()
                : 0.0;

        features[4] = coefficientOfVariation(dataPoint.getPriceHistory());

        features[5] = Math.max(0, dataPoint.getSupplierDelay());

        return features;
    }

    private static double coefficientOfVariation(List<Double> values) {
        if (values == null || values.size() < 2) return 0.0;

        double sum = 0.0;
        for (Double v : values) sum += v != null ? v : 0.0;
        double mean = sum / values.size();
        if (mean <= 0) return 0.0;

        double squared = 0.0;
        for (Double v : values) {
            double d = (v != null ? v : 0.0) - mean;
            squared += d * d;
        }
        return Math.sqrt(squared / values.size()) / mean;
    }
}
