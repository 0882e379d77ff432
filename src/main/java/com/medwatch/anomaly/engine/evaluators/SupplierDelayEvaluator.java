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
 * Flags supplier delays longer than rule.threshold days.
 * Escalates to "critical" when the remaining stock runs out before the delayed delivery arrives.
 */
@Component
public class SupplierDelayEvaluator implements SupplyRuleEvaluator {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.SUPPLIER_DELAY;
    }

    @Override
    public Optional<RawFinding> evaluate(DataPoint dataPoint, SupplyRule rule) {
        int delay = dataPoint.getSupplierDelay();
        if (delay <= rule.getThreshold()) {
            return Optional.empty();
        }

        Double daysOfCover = dataPoint.getDaysOfCover();
        boolean stockoutBeforeDelivery = daysOfCover != null && daysOfCover < delay;
        String name = RuleFindings.displayName(dataPoint);

        Map<String, Object> details = RuleFindings.details(rule);
        details.put("supplier", dataPoint.getSupplier());
        details.put("supplierDelayDays", delay);
        details.put("daysOfCover", daysOfCover);
        details.put("stockoutBeforeDelivery", stockoutBeforeDelivery);

        RawFinding.RawFindingBuilder finding = RuleFindings.triggered(dataPoint, rule, "supplier-delay")
                .message(String.format("Supplier %s is %d days late for %s", dataPoint.getSupplier(), delay, name))
                .description(stockoutBeforeDelivery
                        ? String.format("%s will run out in %.1f days, before the delayed delivery arrives.",
                                name, daysOfCover)
                        : String.format("Deliveries of %s are delayed by %d days (limit %.0f).",
                                name, delay, rule.getThreshold()))
                .details(details);
        if (stockoutBeforeDelivery) {
            finding.severity("critical");
        }
        return Optional.of(finding.build());
    }
}
