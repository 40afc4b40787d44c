package com.pos.anomaly.service;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.model.AnalysisReport;
import com.pos.anomaly.model.ShiftAnalysis;
import com.pos.anomaly.model.ShiftRecord;
import com.pos.anomaly.model.StorePerformanceSummary;
import com.pos.anomaly.repository.ShiftRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the analysis over the stored rolling window once a day and keeps the latest report.
 */
@Service
public class ScheduledAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledAnalysisService.class);

    private final ShiftRecordRepository shiftRepository;
    private final ShiftAnalysisService analysisService;
    private final DetectionConfig config;
    private final Clock clock;

    private final AtomicReference<AnalysisReport> latestReport = new AtomicReference<>();

    public ScheduledAnalysisService(ShiftRecordRepository shiftRepository,
                                    ShiftAnalysisService analysisService,
                                    DetectionConfig config,
                                    Clock clock) {
        this.shiftRepository = shiftRepository;
        this.analysisService = analysisService;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(cron = "${detection.schedule.cron:0 5 8 * * *}",
               zone = "${detection.schedule.zone:Asia/Manila}")
    public void runScheduledAnalysis() {
        if (!config.getSchedule().isEnabled()) {
            return;
        }
        try {
            runAnalysis();
        } catch (RuntimeException e) {
            log.error("Scheduled shift analysis failed, keeping previous report: {}", e.getMessage(), e);
        }
    }

    /**
     * Reads the rolling window from the shift store, analyses it and publishes the report.
     */
    public AnalysisReport runAnalysis() {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(config.getBaselineDays()));
        List<ShiftRecord> rows = shiftRepository.findOpenedSince(since);

        AnalysisReport report = analysisService.analyze(rows, now);
        latestReport.set(report);

        for (StorePerformanceSummary summary : report.getStoreSummaries()) {
            if (!summary.isAlert()) {
                continue;
            }
            log.warn("ALERT RUN: store {} ({}) has {} shifts in runs of {} or more consecutive low-sales shifts: {}",
                    summary.getStoreName(), summary.getStoreId(), summary.getAlertRunShiftCount(),
                    config.getMinRunLength(), alertShiftIds(report, summary.getStoreId()));
        }
        return report;
    }

    public Optional<AnalysisReport> getLatestReport() {
        return Optional.ofNullable(latestReport.get());
    }

    private List<String> alertShiftIds(AnalysisReport report, String storeId) {
        return report.getShifts().stream()
                .filter(a -> storeId.equals(a.getShift().getStoreId()))
                .filter(a -> a.getRunFlag().isInAlertRun())
                .map(ShiftAnalysis::getShift)
                .map(ShiftRecord::getShiftId)
                .toList();
    }
}
