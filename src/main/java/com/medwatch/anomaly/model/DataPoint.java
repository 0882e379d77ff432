package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One medicine's observed supply state at a point in time.
 * Immutable once fetched for a batch; preprocessing produces a new instance via {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Observed supply state of a single medicine")
public class DataPoint {

    @Schema(description = "Medicine identifier", example = "MED-0001")
    String medicineId;

    @Schema(description = "Brand / trade name", example = "Amoxil 500mg")
    String medicineName;

    @Schema(description = "Generic name", example = "Amoxicillin")
    String genericName;

    @Schema(description = "Manufacturer", example = "GSK")
    String company;

    @Schema(description = "Disease or therapeutic category the medicine treats", example = "Bacterial infection")
    String disease;

    @Schema(description = "Units currently in stock", example = "120")
    long currentStock;

    @Schema(description = "Current unit price", example = "14.50")
    double currentPrice;

    @Schema(description = "Average market unit price", example = "12.00")
    double averageMarketPrice;

    @Schema(description = "Stock level below which supply is considered critical", example = "200")
    long criticalThreshold;

    @Schema(description = "Average units consumed per day", example = "35.0")
    double dailyConsumption;

    @Schema(description = "Historical stock levels, most recent first", example = "[120, 180, 260]")
    @Builder.Default
    List<Long> stockHistory = List.of();

    @Schema(description = "Historical unit prices, most recent first", example = "[14.5, 12.1, 12.0]")
    @Builder.Default
    List<Double> priceHistory = List.of();

    @Schema(description = "Supplier name", example = "MedSupply Ltd")
    String supplier;

    @Schema(description = "Current supplier delay in days", example = "4")
    int supplierDelay;

    @Schema(description = "Facility or region", example = "Nairobi Central")
    String location;

    @Schema(description = "Last update time reported by the source (ISO-8601)", example = "2026-10-18T09:30:00Z")
    String lastUpdatedAt;

    @Schema(description = "Free-text description of the current supply situation")
    String description;

    @Schema(description = "Known causes of a shortage, if any", example = "Import restrictions")
    String causesOfShortage;

    // Derived during preprocessing
    @Schema(description = "Average daily stock decline over the three most recent readings (derived)")
    Double currentDeclineRate;

    @Schema(description = "Days until stock runs out at the current consumption rate (derived)")
    Double daysOfCover;

    @Schema(description = "Projected stockout date, ISO-8601 (derived)")
    String projectedStockoutDate;
}
