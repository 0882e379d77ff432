package com.medwatch.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Configuration for a supply anomaly rule")
public class SupplyRule {

    @Schema(description = "Unique rule identifier", example = "RULE-LOW-STOCK")
    private String ruleId;

    @Schema(description = "Rule display name", example = "Low Stock")
    private String name;

    @Schema(description = "What the rule detects",
            example = "Flags medicines whose stock has fallen below their critical threshold")
    private String description;

    @Schema(description = "The kind of check this rule performs", example = "LOW_STOCK")
    private RuleType ruleType;

    @Schema(description = "Rule threshold. Meaning depends on the rule type: ratio of critical threshold for LOW_STOCK, " +
            "days for DAYS_OF_COVER and SUPPLIER_DELAY, percent above market for PRICE_SPIKE, " +
            "multiple of daily consumption for RAPID_DEPLETION", example = "1.0")
    private double threshold;

    @Schema(description = "Severity assigned to findings from this rule", example = "high",
            allowableValues = {"low", "medium", "high", "critical"})
    @Builder.Default
    private String severity = "medium";

    @Schema(description = "Whether this rule is currently active", example = "true")
    @Builder.Default
    private boolean enabled = true;

    @Schema(description = "Rule-specific parameters", example = "{\"criticalDays\": \"2\"}")
    @Builder.Default
    private Map<String, String> params = new HashMap<>();

    public double getParamAsDouble(String key, double defaultValue) {
        String val = params != null ? params.get(key) : null;
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
