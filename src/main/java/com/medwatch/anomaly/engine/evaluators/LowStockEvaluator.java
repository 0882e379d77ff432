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
 * Flags medicines whose stock has dropped below their critical threshold.
 *
 * Trigger: currentStock < criticalThreshold × rule.threshold (threshold 1.0 = exactly the critical level).
 * Severity: "critical" when the shelf is empty, the rule's severity otherwise.
 * Skipped for medicines without a configured critical threshold.
 */
@Component
public class LowStockEvaluator implements SupplyRuleEvaluator {

    private static final double DEFAULT_RATIO = 1.0;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.LOW_STOCK;
    }

    @Override
    public Optional<RawFinding> evaluate(DataPoint dataPoint, SupplyRule rule) {
        if (dataPoint.getCriticalThreshold() <= 0) {
            return Optional.empty();
        }

        double ratio = rule.getThreshold() > 0 ? rule.getThreshold() : DEFAULT_RATIO;
        double limit = dataPoint.getCriticalThreshold() * ratio;
        if (dataPoint.getCurrentStock() >= limit) {
            return Optional.empty();
        }

        boolean outOfStock = dataPoint.getCurrentStock() == 0;
        String name = RuleFindings.displayName(dataPoint);

        Map<String, Object> details = RuleFindings.details(rule);
        details.put("currentStock", dataPoint.getCurrentStock());
        details.put("criticalThreshold", dataPoint.getCriticalThreshold());
        details.put("stockRatio", dataPoint.getCurrentStock() / (double) dataPoint.getCriticalThreshold());
        details.put("location", dataPoint.getLocation());
        details.put("supplier", dataPoint.getSupplier());

        RawFinding.RawFindingBuilder finding = RuleFindings.triggered(dataPoint, rule, "low-stock")
                .message(String.format("Stock for %s (%d) is below the critical threshold (%d)",
                        name, dataPoint.getCurrentStock(), dataPoint.getCriticalThreshold()))
                .description(outOfStock
                        ? String.format("%s is out of stock at %s.", name, dataPoint.getLocation())
                        : String.format("%s has %d units left against a critical level of %d.",
                                name, dataPoint.getCurrentStock(), dataPoint.getCriticalThreshold()))
                .details(details);
        if (outOfStock) {
            finding.severity("critical");
        }
        return Optional.of(finding.build());
    }
}
