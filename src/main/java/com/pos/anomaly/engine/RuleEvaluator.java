package com.pos.anomaly.engine;

import com.pos.anomaly.model.AnomalyRuleType;
import com.pos.anomaly.model.Baseline;
import com.pos.anomaly.model.RuleResult;

/**
 * Interface for the low-value rules applied to a shift metric.
 * Each implementation handles a specific AnomalyRuleType.
 */
public interface RuleEvaluator {

    /**
     * The rule type this evaluator handles.
     */
    AnomalyRuleType getSupportedRuleType();

    /**
     * Judge one metric value against its cohort baseline.
     *
     * @param value    the shift's metric value (sales, or a product count), never negative
     * @param baseline the historical baseline of the shift's store cohort
     * @return the evaluation result for this rule
     */
    RuleResult evaluate(double value, Baseline baseline);
}
