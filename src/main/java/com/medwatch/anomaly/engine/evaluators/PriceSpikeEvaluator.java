package com.medwatch.anomaly.engine.evaluators;

import com.medwatch.anomaly.engine.SupplyRuleEvaluator;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RawFinding;
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags prices more than rule.threshold percent above the average market price.
 *
 * Escalates to "critical" at params["criticalPct"] (default 100, i.e. double the market price).
 * The previous recorded price, when available, is included to show whether the jump is sudden.
 */
@Component
public class PriceSpikeEvaluator implements SupplyRuleEvaluator {

    private static final double DEFAULT_CRITICAL_PCT = 100.0;

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.PRICE_SPIKE;
    }

    @Override
    public Optional<RawFinding> evaluate(DataPoint dataPoint, SupplyRule rule) {
        double marketPrice = dataPoint.getAverageMarketPrice();
        if (marketPrice <= 0) {
            return Optional.empty();
        }

        double deviationPct = (dataPoint.getCurrentPrice() / marketPrice - 1.0) * 100.0;
        if (deviationPct <= rule.getThreshold()) {
            return Optional.empty();
        }

        String name = RuleFindings.displayName(dataPoint);
        Map<String, Object> details = RuleFindings.details(rule);
        details.put("currentPrice", dataPoint.getCurrentPrice());
        details.put("averageMarketPrice", marketPrice);
        details.put("deviationPct", Math.round(deviationPct * 100.0) / 100.0);
        List<Double> priceHistory = dataPoint.getPriceHistory();
        if (priceHistory != null && priceHistory.size() > 1) {
            details.put("previousPrice", priceHistory.get(1));
        }

        RawFinding.RawFindingBuilder finding = RuleFindings.triggered(dataPoint, rule, "price-spike")
                .message(String.format("Price of %s is %.1f%% above market average", name, deviationPct))
                .description(String.format("%s sells at %.2f against a market average of %.2f (limit %.0f%%).",
                        name, dataPoint.getCurrentPrice(), marketPrice, rule.getThreshold()))
                .details(details);
        if (deviationPct >= rule.getParamAsDouble("criticalPct", DEFAULT_CRITICAL_PCT)) {
            finding.severity("critical");
        }
        return Optional.of(finding.build());
    }
}
