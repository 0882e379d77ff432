package com.medwatch.anomaly.engine;

import com.medwatch.anomaly.engine.spi.DataPreprocessor;
import com.medwatch.anomaly.exception.PreprocessException;
import com.medwatch.anomaly.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Cleans fetched medicine records and derives the supply metrics the detectors work on.
 *
 * Cleaning: records without a medicine ID are dropped, text fields are trimmed,
 * negative stock, prices and consumption are clamped to zero.
 *
 * Derived metrics:
 *   currentDeclineRate    = (h[2] - h[0]) / 2 over the three most recent stock readings, positive when falling
 *   daysOfCover           = currentStock / dailyConsumption
 *   projectedStockoutDate = today + floor(daysOfCover) days, left unset past a century
 */
@Component
public class MedicineDataPreprocessor implements DataPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(MedicineDataPreprocessor.class);

    static final String DEFAULT_DESCRIPTION = "No description provided.";
    private static final int DECLINE_WINDOW = 3;
    static final long MAX_PROJECTION_DAYS = 36_500L;

    private final Clock clock;

    public MedicineDataPreprocessor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<DataPoint> preprocess(List<DataPoint> dataPoints) {
        List<DataPoint> prepared = new ArrayList<>(dataPoints.size());
        int dropped = 0;

        for (DataPoint raw : dataPoints) {
            if (raw == null || isBlank(raw.getMedicineId())) {
                dropped++;
                continue;
            }
            try {
                prepared.add(prepare(raw));
            } catch (RuntimeException e) {
                throw new PreprocessException("Failed to preprocess medicine " + raw.getMedicineId(), e);
            }
        }

        if (dropped > 0) {
            log.warn("Dropped {} data points without a medicine ID", dropped);
        }
        return prepared;
    }

    private DataPoint prepare(DataPoint raw) {
        long stock = Math.max(0L, raw.getCurrentStock());
        double consumption = Math.max(0.0, raw.getDailyConsumption());
        List<Long> stockHistory = raw.getStockHistory() != null ? raw.getStockHistory() : List.of();
        List<Double> priceHistory = raw.getPriceHistory() != null ? raw.getPriceHistory() : List.of();
        Double daysOfCover = daysOfCover(stock, consumption);

        return raw.toBuilder()
                .medicineId(raw.getMedicineId().trim())
                .medicineName(trim(raw.getMedicineName()))
                .genericName(trim(raw.getGenericName()))
                .company(trim(raw.getCompany()))
                .disease(trim(raw.getDisease()))
                .supplier(trim(raw.getSupplier()))
                .location(trim(raw.getLocation()))
                .currentStock(stock)
                .currentPrice(Math.max(0.0, raw.getCurrentPrice()))
                .averageMarketPrice(Math.max(0.0, raw.getAverageMarketPrice()))
                .criticalThreshold(Math.max(0L, raw.getCriticalThreshold()))
                .dailyConsumption(consumption)
                .supplierDelay(Math.max(0, raw.getSupplierDelay()))
                .stockHistory(stockHistory)
                .priceHistory(priceHistory)
                .description(isBlank(raw.getDescription()) ? DEFAULT_DESCRIPTION : raw.getDescription().trim())
                .causesOfShortage(raw.getCausesOfShortage() != null ? raw.getCausesOfShortage().trim() : "")
                .currentDeclineRate(declineRate(stockHistory))
                .daysOfCover(daysOfCover)
                .projectedStockoutDate(projectStockout(daysOfCover))
                .build();
    }

    private String projectStockout(Double daysOfCover) {
        if (daysOfCover == null || daysOfCover > MAX_PROJECTION_DAYS) {
            return null;
        }
        return clock.instant().plus((long) Math.floor(daysOfCover), ChronoUnit.DAYS).toString();
    }

    static Double declineRate(List<Long> stockHistory) {
        if (stockHistory.size() < DECLINE_WINDOW) {
            return null;
        }
        Long newest = stockHistory.get(0);
        Long oldest = stockHistory.get(DECLINE_WINDOW - 1);
        if (newest == null || oldest == null) {
            return null;
        }
        return (oldest - newest) / (double) (DECLINE_WINDOW - 1);
    }

    static Double daysOfCover(long stock, double dailyConsumption) {
        if (stock <= 0 || dailyConsumption <= 0) {
            return null;
        }
        return stock / dailyConsumption;
    }

    private static String trim(String value) {
        return value != null ? value.trim() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
