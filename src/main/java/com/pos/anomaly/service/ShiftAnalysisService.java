package com.pos.anomaly.service;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.config.MetricsConfig;
import com.pos.anomaly.engine.AnomalyClassifier;
import com.pos.anomaly.engine.BaselineEstimator;
import com.pos.anomaly.engine.BaselineSample;
import com.pos.anomaly.engine.CohortClassifier;
import com.pos.anomaly.engine.CohortShift;
import com.pos.anomaly.engine.RatioAnalyzer;
import com.pos.anomaly.engine.RunCandidate;
import com.pos.anomaly.engine.RunDetector;
import com.pos.anomaly.model.AnalysisReport;
import com.pos.anomaly.model.AnomalyVerdict;
import com.pos.anomaly.model.Baseline;
import com.pos.anomaly.model.BaselineKey;
import com.pos.anomaly.model.CohortKey;
import com.pos.anomaly.model.RuleResult;
import com.pos.anomaly.model.RunFlag;
import com.pos.anomaly.model.ShiftAnalysis;
import com.pos.anomaly.model.ShiftPerformance;
import com.pos.anomaly.model.ShiftRatioAnalysis;
import com.pos.anomaly.model.ShiftRecord;
import com.pos.anomaly.model.StorePerformanceSummary;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Main orchestrator for one analysis run.
 *
 * Flow:
 * 1. Reject rows without an opening time, fail on contract violations
 * 2. Keep the rolling baseline window and tag each shift with its cohort
 * 3. Split at now - analysisDays into historical and recent shifts
 * 4. Estimate per (store, cohort) sales baselines from the historical shifts
 * 5. Classify each recent shift and detect runs per store in opening order
 * 6. Analyse product pairs and summarise each store's overall performance
 *
 * The run is a pure function of the rows and the supplied reference time.
 */
@Service
public class ShiftAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(ShiftAnalysisService.class);

    static final Comparator<ShiftRecord> SHIFT_ORDER = Comparator
            .comparing(ShiftRecord::getOpenedAt)
            .thenComparing(ShiftRecord::getShiftId);

    private final DetectionConfig config;
    private final CohortClassifier cohortClassifier;
    private final BaselineEstimator baselineEstimator;
    private final AnomalyClassifier anomalyClassifier;
    private final RunDetector runDetector;
    private final RatioAnalyzer ratioAnalyzer;
    private final MetricsConfig metricsConfig;

    public ShiftAnalysisService(DetectionConfig config,
                                CohortClassifier cohortClassifier,
                                BaselineEstimator baselineEstimator,
                                AnomalyClassifier anomalyClassifier,
                                RunDetector runDetector,
                                RatioAnalyzer ratioAnalyzer,
                                MetricsConfig metricsConfig) {
        this.config = config;
        this.cohortClassifier = cohortClassifier;
        this.baselineEstimator = baselineEstimator;
        this.anomalyClassifier = anomalyClassifier;
        this.runDetector = runDetector;
        this.ratioAnalyzer = ratioAnalyzer;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "shifts.analyze", contextualName = "analyze-shifts")
    public AnalysisReport analyze(List<ShiftRecord> rows, Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("Reference time is required");
        }
        if (rows == null) {
            throw new IllegalArgumentException("Shift rows are required");
        }
        // Read once per run; the config can change concurrently through the REST API
        int baselineDays = config.getBaselineDays();
        int analysisDays = config.getAnalysisDays();
        Instant baselineStart = now.minus(Duration.ofDays(baselineDays));
        Instant analysisStart = now.minus(Duration.ofDays(analysisDays));
        double baselineWeeks = (baselineDays - analysisDays) / 7.0;

        // 1-2. Validate, window and cohort-tag
        int rejected = 0;
        int excluded = 0;
        Map<String, Set<String>> seenIds = new TreeMap<>();
        List<CohortShift> historical = new ArrayList<>();
        List<CohortShift> recent = new ArrayList<>();

        for (ShiftRecord row : rows) {
            if (row == null) {
                throw new IllegalArgumentException("Shift rows must not contain null entries");
            }
            if (row.getOpenedAt() == null) {
                rejected++;
                log.warn("Rejecting shift {} of store {}: missing or unparseable opening time", row.getShiftId(), row.getStoreId());
                continue;
            }
            requireValid(row);
            if (!seenIds.computeIfAbsent(row.getStoreId(), k -> new HashSet<>()).add(row.getShiftId())) {
                throw new IllegalArgumentException(String.format(
                        "Duplicate shift %s in store %s", row.getShiftId(), row.getStoreId()));
            }
            if (row.getOpenedAt().isBefore(baselineStart)) {
                continue;
            }

            Optional<CohortKey> cohort = cohortClassifier.classify(row.getOpenedAt());
            if (cohort.isEmpty()) {
                excluded++;
                continue;
            }

            // 3. Split
            CohortShift tagged = new CohortShift(row, cohort.get());
            if (row.getOpenedAt().isBefore(analysisStart)) {
                historical.add(tagged);
            } else {
                recent.add(tagged);
            }
        }

        // 4. Baselines
        List<BaselineSample> samples = new ArrayList<>(historical.size());
        for (CohortShift tagged : historical) {
            samples.add(new BaselineSample(
                    tagged.getShift().getStoreId(), tagged.getCohort(), tagged.getShift().getTotalSales()));
        }
        Map<BaselineKey, Baseline> baselines = baselineEstimator.estimate(samples);

        // 5. Classify and detect runs, store by store
        Map<String, List<CohortShift>> recentByStore = groupByStore(recent);
        Map<String, List<CohortShift>> historicalByStore = groupByStore(historical);

        List<ShiftAnalysis> analyses = new ArrayList<>();
        List<StorePerformanceSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, List<CohortShift>> entry : recentByStore.entrySet()) {
            String storeId = entry.getKey();
            List<ShiftAnalysis> storeAnalyses = analyzeStore(storeId, entry.getValue(), baselines);
            analyses.addAll(storeAnalyses);
            summaries.add(summarizeStore(storeId, storeAnalyses,
                    historicalByStore.getOrDefault(storeId, List.of()), baselineWeeks));
        }

        // 6. Product pairs
        List<ShiftRatioAnalysis> ratioAnalyses = ratioAnalyzer.analyze(historical, sortedForReport(recent));

        recordOutcome(analyses, summaries, rejected);

        log.info("Shift analysis complete: window=[{}, {}), split={}, historical={}, recent={}, " +
                        "rejected={}, excluded={}, anomalous={}, storesInAlert={}",
                baselineStart, now, analysisStart, historical.size(), recent.size(), rejected, excluded,
                analyses.stream().filter(a -> a.getVerdict().isAnomalous()).count(),
                summaries.stream().filter(StorePerformanceSummary::isAlert).count());

        return AnalysisReport.builder()
                .generatedAt(now)
                .baselineStart(baselineStart)
                .analysisStart(analysisStart)
                .shifts(analyses)
                .ratioAnalyses(ratioAnalyses)
                .storeSummaries(summaries)
                .rejectedRows(rejected)
                .excludedRows(excluded)
                .build();
    }

    private List<ShiftAnalysis> analyzeStore(String storeId, List<CohortShift> shifts,
                                             Map<BaselineKey, Baseline> baselines) {
        List<CohortShift> ordered = new ArrayList<>(shifts);
        ordered.sort(Comparator.comparing(CohortShift::getShift, SHIFT_ORDER));

        List<AnomalyVerdict> verdicts = new ArrayList<>(ordered.size());
        List<Baseline> shiftBaselines = new ArrayList<>(ordered.size());
        List<RunCandidate> candidates = new ArrayList<>(ordered.size());
        for (CohortShift tagged : ordered) {
            ShiftRecord shift = tagged.getShift();
            Baseline baseline = baselineEstimator.lookup(baselines, storeId, tagged.getCohort());
            AnomalyVerdict verdict = anomalyClassifier.classify(shift.getTotalSales(), baseline);
            shiftBaselines.add(baseline);
            verdicts.add(verdict);
            candidates.add(new RunCandidate(shift.getShiftId(), shift.getOpenedAt(), verdict.isAnomalous()));

            if (verdict.isAnomalous()) {
                log.debug("Shift {} of store {} ({}) flagged: sales={}, mean={}, std={}, reasons={}",
                        shift.getShiftId(), storeId, tagged.getCohort().getLabel(), shift.getTotalSales(),
                        baseline.getMean(), baseline.getStdDev(), verdict.getReasons());
            }
        }

        List<RunFlag> runFlags = runDetector.detect(candidates);

        List<ShiftAnalysis> result = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            CohortShift tagged = ordered.get(i);
            result.add(ShiftAnalysis.builder()
                    .shift(tagged.getShift())
                    .cohort(tagged.getCohort())
                    .baseline(shiftBaselines.get(i))
                    .verdict(verdicts.get(i))
                    .runFlag(runFlags.get(i))
                    .performance(performance(tagged.getShift().getTotalSales(), shiftBaselines.get(i)))
                    .build());
        }
        return result;
    }

    ShiftPerformance performance(double sales, Baseline baseline) {
        double mean = baseline.getMean();
        double difference = sales - mean;
        double pct = mean != 0 ? difference / mean * 100.0 : 0.0;
        return ShiftPerformance.builder()
                .baselineMean(mean)
                .salesDifference(difference)
                .performancePct(pct)
                .build();
    }

    /**
     * Compares the store's recent total with its average weekly total over the
     * historical part of the window, which spans baselineWeeks weeks.
     */
    StorePerformanceSummary summarizeStore(String storeId, List<ShiftAnalysis> recent,
                                           List<CohortShift> historical, double baselineWeeks) {
        double recentTotal = 0.0;
        int anomalous = 0;
        int inRun = 0;
        for (ShiftAnalysis analysis : recent) {
            recentTotal += analysis.getShift().getTotalSales();
            if (analysis.getVerdict().isAnomalous()) anomalous++;
            if (analysis.getRunFlag().isInAlertRun()) inRun++;
        }

        double historicalTotal = 0.0;
        for (CohortShift tagged : historical) {
            historicalTotal += tagged.getShift().getTotalSales();
        }
        double avgWeekly = baselineWeeks > 0 ? historicalTotal / baselineWeeks : 0.0;
        boolean hasBaseline = avgWeekly > 0;
        double difference = recentTotal - avgWeekly;

        return StorePerformanceSummary.builder()
                .storeId(storeId)
                .storeName(config.storeName(storeId))
                .recentTotalSales(recentTotal)
                .avgWeeklyBaselineSales(avgWeekly)
                .salesDifference(difference)
                .pctChange(hasBaseline ? difference / avgWeekly * 100.0 : 0.0)
                .hasBaseline(hasBaseline)
                .recentShiftCount(recent.size())
                .anomalousShiftCount(anomalous)
                .alertRunShiftCount(inRun)
                .alert(inRun > 0)
                .build();
    }

    private void requireValid(ShiftRecord row) {
        if (row.getStoreId() == null || row.getStoreId().isBlank()) {
            throw new IllegalArgumentException("Shift " + row.getShiftId() + " has no store id");
        }
        if (row.getShiftId() == null || row.getShiftId().isBlank()) {
            throw new IllegalArgumentException("Shift of store " + row.getStoreId() + " has no shift id");
        }
        if (Double.isNaN(row.getTotalSales()) || row.getTotalSales() < 0) {
            throw new IllegalArgumentException(String.format(
                    "Shift %s has invalid total sales %s", row.getShiftId(), row.getTotalSales()));
        }
        if ((row.getProductACount() != null && row.getProductACount() < 0)
                || (row.getProductBCount() != null && row.getProductBCount() < 0)) {
            throw new IllegalArgumentException("Shift " + row.getShiftId() + " has a negative product count");
        }
    }

    private Map<String, List<CohortShift>> groupByStore(List<CohortShift> shifts) {
        Map<String, List<CohortShift>> byStore = new TreeMap<>();
        for (CohortShift tagged : shifts) {
            byStore.computeIfAbsent(tagged.getShift().getStoreId(), k -> new ArrayList<>()).add(tagged);
        }
        return byStore;
    }

    private List<CohortShift> sortedForReport(List<CohortShift> shifts) {
        List<CohortShift> sorted = new ArrayList<>(shifts);
        sorted.sort(Comparator.comparing((CohortShift c) -> c.getShift().getStoreId())
                .thenComparing(CohortShift::getShift, SHIFT_ORDER));
        return sorted;
    }

    private void recordOutcome(List<ShiftAnalysis> analyses, List<StorePerformanceSummary> summaries,
                               int rejected) {
        for (ShiftAnalysis analysis : analyses) {
            metricsConfig.recordShiftOutcome(analysis.getVerdict().isAnomalous() ? "anomalous" : "normal");
            for (RuleResult result : analysis.getVerdict().getRuleResults()) {
                if (result.isTriggered()) {
                    metricsConfig.recordRuleTriggered(result.getRuleType().name());
                }
            }
        }
        if (rejected > 0) {
            metricsConfig.recordRejectedRows(rejected);
        }

        int storesInAlert = 0;
        for (StorePerformanceSummary summary : summaries) {
            if (summary.isAlert()) {
                storesInAlert++;
                metricsConfig.recordAlertRun(summary.getStoreId());
            }
        }
        metricsConfig.updateStoresInAlert(storesInAlert);
    }
}
