package com.pos.anomaly.engine;

import com.pos.anomaly.model.Baseline;
import com.pos.anomaly.model.BaselineKey;
import com.pos.anomaly.model.CohortKey;
import com.pos.anomaly.model.TimeSlot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BaselineEstimatorTest {

    private static final CohortKey MON_AM = new CohortKey("Mon", TimeSlot.AM);
    private static final CohortKey MON_PM = new CohortKey("Mon", TimeSlot.PM);

    private final BaselineEstimator estimator = new BaselineEstimator();

    @Test
    void estimate_computesMeanAndSampleStdDev() {
        Map<BaselineKey, Baseline> baselines = estimator.estimate(samples("S1", MON_AM, 100, 110, 90, 105, 95));

        Baseline baseline = estimator.lookup(baselines, "S1", MON_AM);
        assertThat(baseline.getMean()).isCloseTo(100.0, within(1e-9));
        assertThat(baseline.getStdDev()).isCloseTo(7.9057, within(1e-4));
        assertThat(baseline.getSampleCount()).isEqualTo(5);
    }

    @Test
    void estimate_singleSample_hasZeroStdDev() {
        Map<BaselineKey, Baseline> baselines = estimator.estimate(samples("S1", MON_AM, 250));

        Baseline baseline = estimator.lookup(baselines, "S1", MON_AM);
        assertThat(baseline.getMean()).isEqualTo(250.0);
        assertThat(baseline.getStdDev()).isZero();
        assertThat(baseline.getSampleCount()).isEqualTo(1);
    }

    @Test
    void estimate_identicalSamples_haveZeroStdDev() {
        Map<BaselineKey, Baseline> baselines = estimator.estimate(samples("S1", MON_AM, 80, 80, 80));

        assertThat(estimator.lookup(baselines, "S1", MON_AM).getStdDev()).isZero();
    }

    @Test
    void estimate_outlierIncreasesStdDev() {
        Baseline without = estimator.lookup(
                estimator.estimate(samples("S1", MON_AM, 100, 110, 90, 105, 95)), "S1", MON_AM);
        Baseline with = estimator.lookup(
                estimator.estimate(samples("S1", MON_AM, 100, 110, 90, 105, 95, 400)), "S1", MON_AM);

        assertThat(with.getStdDev()).isGreaterThan(without.getStdDev());
    }

    @Test
    void estimate_keepsStoresAndCohortsApart() {
        List<BaselineSample> all = new ArrayList<>(samples("S1", MON_AM, 100, 200));
        all.addAll(samples("S1", MON_PM, 1000));
        all.addAll(samples("S2", MON_AM, 10, 20, 30));

        Map<BaselineKey, Baseline> baselines = estimator.estimate(all);

        assertThat(baselines).hasSize(3);
        assertThat(estimator.lookup(baselines, "S1", MON_AM).getMean()).isEqualTo(150.0);
        assertThat(estimator.lookup(baselines, "S1", MON_PM).getMean()).isEqualTo(1000.0);
        assertThat(estimator.lookup(baselines, "S2", MON_AM).getMean()).isEqualTo(20.0);
    }

    @Test
    void estimate_isIdempotent() {
        List<BaselineSample> input = samples("S1", MON_AM, 12.5, 99.1, 47.3, 3.3, 71.9);

        assertThat(estimator.estimate(input)).isEqualTo(estimator.estimate(input));
    }

    @Test
    void lookup_unknownCohort_returnsEmptyBaseline() {
        Map<BaselineKey, Baseline> baselines = estimator.estimate(samples("S1", MON_AM, 100, 120));

        Baseline missing = estimator.lookup(baselines, "S1", MON_PM);
        assertThat(missing.getMean()).isZero();
        assertThat(missing.getStdDev()).isZero();
        assertThat(missing.hasHistory()).isFalse();
    }

    @Test
    void estimate_noSamples_returnsEmptyMap() {
        assertThat(estimator.estimate(List.of())).isEmpty();
    }

    private static List<BaselineSample> samples(String storeId, CohortKey cohort, double... values) {
        List<BaselineSample> samples = new ArrayList<>();
        for (double v : values) {
            samples.add(new BaselineSample(storeId, cohort, v));
        }
        return samples;
    }
}
