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
 * Flags stock falling much faster than the usual consumption rate (hoarding, leakage, diversion).
 * Trigger: recent decline rate > dailyConsumption × rule.threshold.
 */
@Component
public class RapidDepletionEvaluator implements SupplyRuleEvaluator {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.RAPID_DEPLETION;
    }

    @Override
    public Optional<RawFinding> evaluate(DataPoint dataPoint, SupplyRule rule) {
        Double declineRate = dataPoint.getCurrentDeclineRate();
        double consumption = dataPoint.getDailyConsumption();
        if (declineRate == null || consumption <= 0) {
            return Optional.empty();
        }

        double multiple = declineRate / consumption;
        if (multiple <= rule.getThreshold()) {
            return Optional.empty();
        }

        String name = RuleFindings.displayName(dataPoint);
        Map<String, Object> details = RuleFindings.details(rule);
        details.put("declineRate", declineRate);
        details.put("dailyConsumption", consumption);
        details.put("consumptionMultiple", Math.round(multiple * 100.0) / 100.0);
        details.put("recentStock", dataPoint.getStockHistory());

        return Optional.of(RuleFindings.triggered(dataPoint, rule, "rapid-depletion")
                .message(String.format("Stock of %s is falling %.1fx faster than normal consumption", name, multiple))
                .description(String.format("%s lost %.1f units/day recently against a usual %.1f units/day.",
                        name, declineRate, consumption))
                .details(details)
                .build());
    }
}
