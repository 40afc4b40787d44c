package com.pos.anomaly.engine.evaluators;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.engine.RuleEvaluator;
import com.pos.anomaly.model.AnomalyRuleType;
import com.pos.anomaly.model.Baseline;
import com.pos.anomaly.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Flags a value below a fixed fraction of its cohort mean, independent of variance.
 *
 * Logic: triggered if value < mean * hardFloorRatio. With mean 0 (no history)
 * the floor is 0 and no non-negative value can fall below it.
 */
@Component
public class HardFloorEvaluator implements RuleEvaluator {

    private final DetectionConfig config;

    public HardFloorEvaluator(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyRuleType getSupportedRuleType() {
        return AnomalyRuleType.HARD_FLOOR;
    }

    @Override
    public RuleResult evaluate(double value, Baseline baseline) {
        double ratio = config.getHardFloorRatio();
        double threshold = baseline.getMean() * ratio;
        boolean triggered = value < threshold;

        String reason = String.format(
                "Hard floor: value=%.2f %s %.0f%% of mean %.2f = %.2f",
                value, triggered ? "<" : ">=", ratio * 100.0, baseline.getMean(), threshold);

        return RuleResult.builder()
                .ruleType(getSupportedRuleType())
                .triggered(triggered)
                .observedValue(value)
                .threshold(threshold)
                .reason(reason)
                .build();
    }
}
