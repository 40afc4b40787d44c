package com.pos.anomaly.engine;

import com.pos.anomaly.model.Baseline;
import com.pos.anomaly.model.BaselineKey;
import com.pos.anomaly.model.CohortKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes per (store, cohort) mean and sample standard deviation from historical samples.
 *
 * Groups with fewer than 2 samples get stdDev = 0, which disables the statistical
 * rule for them. Sums run in input order so identical input yields identical output.
 */
@Component
public class BaselineEstimator {

    public Map<BaselineKey, Baseline> estimate(Collection<BaselineSample> samples) {
        Map<BaselineKey, List<Double>> groups = new LinkedHashMap<>();
        for (BaselineSample sample : samples) {
            groups.computeIfAbsent(new BaselineKey(sample.getStoreId(), sample.getCohort()),
                    k -> new ArrayList<>()).add(sample.getValue());
        }

        Map<BaselineKey, Baseline> baselines = new LinkedHashMap<>();
        for (Map.Entry<BaselineKey, List<Double>> entry : groups.entrySet()) {
            baselines.put(entry.getKey(), compute(entry.getValue()));
        }
        return baselines;
    }

    /**
     * Baseline of a store cohort, or an empty baseline (mean 0, stdDev 0) when the cohort has no history.
     */
    public Baseline lookup(Map<BaselineKey, Baseline> baselines, String storeId, CohortKey cohort) {
        Baseline baseline = baselines.get(new BaselineKey(storeId, cohort));
        return baseline != null ? baseline : Baseline.empty();
    }

    Baseline compute(List<Double> values) {
        int n = values.size();
        if (n == 0) {
            return Baseline.empty();
        }

        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;

        double stdDev = 0.0;
        if (n >= 2) {
            double squares = 0.0;
            for (double v : values) {
                double diff = v - mean;
                squares += diff * diff;
            }
            stdDev = Math.sqrt(squares / (n - 1));
        }

        return Baseline.builder()
                .mean(mean)
                .stdDev(stdDev)
                .sampleCount(n)
                .build();
    }
}
