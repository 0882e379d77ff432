package com.medwatch.anomaly.engine.evaluators;

import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RawFinding;
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;
import com.medwatch.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RapidDepletionEvaluatorTest {

    private final RapidDepletionEvaluator evaluator = new RapidDepletionEvaluator();
    private final SupplyRule rule = TestDataFactory.createSupplyRule("RULE-RAPID-DEPLETION", RuleType.RAPID_DEPLETION, 2.0);

    @Test
    void declineAtUsualRate_noFinding() {
        assertThat(evaluator.evaluate(TestDataFactory.createDataPoint("MED-1"), rule)).isEmpty();
    }

    @Test
    void declineWellAboveConsumption_flagged() {
        DataPoint dp = TestDataFactory.healthyMedicine("MED-1").currentDeclineRate(90.0).build();

        Optional<RawFinding> finding = evaluator.evaluate(dp, rule);

        assertThat(finding).isPresent();
        assertThat(finding.get().getType()).isEqualTo("rapid-depletion");
        @SuppressWarnings("unchecked")
        Map<String, Object> details = (Map<String, Object>) finding.get().getDetails();
        assertThat(details).containsEntry("consumptionMultiple", 4.5);
    }

    @Test
    void noConsumptionBaseline_skipped() {
        DataPoint dp = TestDataFactory.healthyMedicine("MED-1").dailyConsumption(0).currentDeclineRate(90.0).build();

        assertThat(evaluator.evaluate(dp, rule)).isEmpty();
    }

    @Test
    void declineNotDerived_skipped() {
        DataPoint dp = TestDataFactory.healthyMedicine("MED-1").currentDeclineRate(null).build();

        assertThat(evaluator.evaluate(dp, rule)).isEmpty();
    }
}
