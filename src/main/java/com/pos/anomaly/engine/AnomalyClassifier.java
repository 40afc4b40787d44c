package com.pos.anomaly.engine;

import com.pos.anomaly.model.AnomalyRuleType;
import com.pos.anomaly.model.AnomalyVerdict;
import com.pos.anomaly.model.Baseline;
import com.pos.anomaly.model.RuleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether one shift's metric value is anomalous for its cohort.
 * Every registered RuleEvaluator is applied and the results are combined by OR.
 */
@Component
public class AnomalyClassifier {

    private static final Logger log = LoggerFactory.getLogger(AnomalyClassifier.class);

    private final Map<AnomalyRuleType, RuleEvaluator> evaluatorMap;

    public AnomalyClassifier(List<RuleEvaluator> evaluators) {
        this.evaluatorMap = new EnumMap<>(AnomalyRuleType.class);

        for (RuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedRuleType(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedRuleType(), evaluator.getClass().getSimpleName());
        }
    }

    /**
     * Classify a metric value against its cohort baseline.
     *
     * @param value    non-negative, finite metric value
     * @param baseline cohort baseline; null is treated as a cohort without history
     */
    public AnomalyVerdict classify(double value, Baseline baseline) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException("Metric value must be a finite non-negative number, got " + value);
        }
        Baseline effective = baseline != null ? baseline : Baseline.empty();

        List<RuleResult> results = new ArrayList<>();
        Set<String> reasons = new LinkedHashSet<>();
        boolean statistical = false;
        boolean hardRule = false;

        // EnumMap iterates in declaration order, so reasons come out in a stable order
        for (RuleEvaluator evaluator : evaluatorMap.values()) {
            RuleResult result = evaluator.evaluate(value, effective);
            results.add(result);
            if (!result.isTriggered()) {
                continue;
            }
            reasons.add(result.getRuleType().getReasonTag());
            if (result.getRuleType() == AnomalyRuleType.STATISTICAL_DEVIATION) {
                statistical = true;
            } else if (result.getRuleType() == AnomalyRuleType.HARD_FLOOR) {
                hardRule = true;
            }
        }

        return AnomalyVerdict.builder()
                .statisticalAnomaly(statistical)
                .hardRuleAnomaly(hardRule)
                .anomalous(statistical || hardRule)
                .reasons(reasons)
                .ruleResults(results)
                .build();
    }
}
