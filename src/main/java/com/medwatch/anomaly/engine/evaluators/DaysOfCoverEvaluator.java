package com.medwatch.anomaly.engine.evaluators;

import com.medwatch.anomaly.engine.SupplyRuleEvaluator;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RawFinding;
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Flags medicines that will run out within rule.threshold days at the current consumption rate.
 * Escalates to "critical" below params["criticalDays"] (default 2).
 * Needs the days-of-cover metric derived during preprocessing.
 */
@Component
public class DaysOfCoverEvaluator implements SupplyRuleEvaluator {

    private static final double DEFAULT_CRITICAL_DAYS = 2.0;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.DAYS_OF_COVER;
    }

    @Override
    public Optional<RawFinding> evaluate(DataPoint dataPoint, SupplyRule rule) {
        Double daysOfCover = dataPoint.getDaysOfCover();
        if (daysOfCover == null || daysOfCover >= rule.getThreshold()) {
            return Optional.empty();
        }

        double criticalDays = rule.getParamAsDouble("criticalDays", DEFAULT_CRITICAL_DAYS);
        String name = RuleFindings.displayName(dataPoint);

        Map<String, Object> details = RuleFindings.details(rule);
        details.put("daysOfCover", daysOfCover);
        details.put("dailyConsumption", dataPoint.getDailyConsumption());
        details.put("currentStock", dataPoint.getCurrentStock());
        details.put("projectedStockoutDate", dataPoint.getProjectedStockoutDate());

        RawFinding.RawFindingBuilder finding = RuleFindings.triggered(dataPoint, rule, "stockout-risk")
                .message(String.format("%s will run out in %.1f days", name, daysOfCover))
                .description(String.format(
                        "At %.1f units/day the remaining %d units of %s last %.1f days (alert below %.0f days). " +
                                "Projected stockout: %s.",
                        dataPoint.getDailyConsumption(), dataPoint.getCurrentStock(), name,
                        daysOfCover, rule.getThreshold(), dataPoint.getProjectedStockoutDate()))
                .details(details);
        if (daysOfCover < criticalDays) {
            finding.severity("critical");
        }
        return Optional.of(finding.build());
    }
}
