package com.pos.anomaly.engine;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.engine.evaluators.StatisticalDeviationEvaluator;
import com.pos.anomaly.model.Baseline;
import com.pos.anomaly.model.BaselineKey;
import com.pos.anomaly.model.RatioVerdict;
import com.pos.anomaly.model.RuleResult;
import com.pos.anomaly.model.ShiftRatioAnalysis;
import com.pos.anomaly.model.ShiftRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies the baseline/classify pattern to a pair of competing products sold in a shift.
 *
 * Two conditions, combined by OR:
 *   - high ratio: productA / productB above the configured threshold. When B sold
 *     nothing and A did, the ratio is the configured sentinel instead of infinity.
 *   - low-count dip: productB below its own cohort's statistical threshold
 *     (same mean - k * stdDev rule, same stdDev > 0 guard as shift sales).
 */
@Component
public class RatioAnalyzer {

    static final String HIGH_RATIO_REASON = "high product ratio";
    static final String LOW_COUNT_DIP_REASON = "product B count dip (statistical)";

    private final DetectionConfig config;
    private final BaselineEstimator baselineEstimator;
    private final StatisticalDeviationEvaluator statisticalEvaluator;

    public RatioAnalyzer(DetectionConfig config,
                         BaselineEstimator baselineEstimator,
                         StatisticalDeviationEvaluator statisticalEvaluator) {
        this.config = config;
        this.baselineEstimator = baselineEstimator;
        this.statisticalEvaluator = statisticalEvaluator;
    }

    /**
     * Analyse the recent shifts that carry both product counts. Product B baselines
     * come from the historical shifts that carry them.
     */
    public List<ShiftRatioAnalysis> analyze(List<CohortShift> historical, List<CohortShift> recent) {
        List<BaselineSample> samples = new ArrayList<>();
        for (CohortShift tagged : historical) {
            ShiftRecord shift = tagged.getShift();
            if (shift.hasProductCounts()) {
                samples.add(new BaselineSample(shift.getStoreId(), tagged.getCohort(), shift.getProductBCount()));
            }
        }
        Map<BaselineKey, Baseline> baselines = baselineEstimator.estimate(samples);

        List<ShiftRatioAnalysis> analyses = new ArrayList<>();
        for (CohortShift tagged : recent) {
            ShiftRecord shift = tagged.getShift();
            if (!shift.hasProductCounts()) {
                continue;
            }
            Baseline baseline = baselineEstimator.lookup(baselines, shift.getStoreId(), tagged.getCohort());
            long a = shift.getProductACount();
            long b = shift.getProductBCount();

            analyses.add(ShiftRatioAnalysis.builder()
                    .shiftId(shift.getShiftId())
                    .storeId(shift.getStoreId())
                    .cohort(tagged.getCohort())
                    .productACount(a)
                    .productBCount(b)
                    .productBBaseline(baseline)
                    .verdict(classify(a, b, baseline))
                    .build());
        }
        return analyses;
    }

    public RatioVerdict classify(long productACount, long productBCount, Baseline productBBaseline) {
        if (productACount < 0 || productBCount < 0) {
            throw new IllegalArgumentException(String.format(
                    "Product counts must not be negative: A=%d, B=%d", productACount, productBCount));
        }
        Baseline baseline = productBBaseline != null ? productBBaseline : Baseline.empty();

        double ratio = ratio(productACount, productBCount);
        boolean highRatio = ratio > config.getRatio().getThreshold();

        RuleResult dip = statisticalEvaluator.evaluate(productBCount, baseline);
        boolean lowCountDip = dip.isTriggered();

        List<String> reasons = new ArrayList<>();
        if (highRatio) {
            reasons.add(HIGH_RATIO_REASON);
        }
        if (lowCountDip) {
            reasons.add(LOW_COUNT_DIP_REASON);
        }

        return RatioVerdict.builder()
                .ratio(ratio)
                .highRatio(highRatio)
                .lowCountDip(lowCountDip)
                .anomalous(highRatio || lowCountDip)
                .reason(String.join("; ", reasons))
                .build();
    }

    public double ratio(long productACount, long productBCount) {
        if (productBCount == 0) {
            return productACount > 0 ? config.getRatio().getSentinel() : 0.0;
        }
        return (double) productACount / productBCount;
    }
}
