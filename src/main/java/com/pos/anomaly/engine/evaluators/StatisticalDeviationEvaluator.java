package com.pos.anomaly.engine.evaluators;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.engine.RuleEvaluator;
import com.pos.anomaly.model.AnomalyRuleType;
import com.pos.anomaly.model.Baseline;
import com.pos.anomaly.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Flags a value that falls more than k standard deviations below its cohort mean.
 *
 * Logic: triggered if stdDev > 0 AND value < mean - k * stdDev.
 * A cohort with zero spread (fewer than 2 samples, or identical samples) never
 * triggers this rule; only the hard floor can fire for it.
 *
 * Example: mean=100, stdDev=10, k=1.8 gives threshold 82. A shift of 81.99 is
 * flagged, 82.01 is not.
 */
@Component
public class StatisticalDeviationEvaluator implements RuleEvaluator {

    private final DetectionConfig config;

    public StatisticalDeviationEvaluator(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyRuleType getSupportedRuleType() {
        return AnomalyRuleType.STATISTICAL_DEVIATION;
    }

    @Override
    public RuleResult evaluate(double value, Baseline baseline) {
        double k = config.getSensitivityK();
        double threshold = baseline.getMean() - k * baseline.getStdDev();

        if (baseline.getStdDev() <= 0) {
            return RuleResult.builder()
                    .ruleType(getSupportedRuleType())
                    .triggered(false)
                    .observedValue(value)
                    .threshold(threshold)
                    .reason("No spread in cohort history, statistical check skipped")
                    .build();
        }

        boolean triggered = value < threshold;
        String reason = String.format(
                "Statistical deviation: value=%.2f %s mean %.2f - %.1f x std %.2f = %.2f",
                value, triggered ? "<" : ">=", baseline.getMean(), k, baseline.getStdDev(), threshold);

        return RuleResult.builder()
                .ruleType(getSupportedRuleType())
                .triggered(triggered)
                .observedValue(value)
                .threshold(threshold)
                .reason(reason)
                .build();
    }
}
