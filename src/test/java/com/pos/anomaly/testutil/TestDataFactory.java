package com.pos.anomaly.testutil;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.model.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final ZoneOffset STORE_ZONE = ZoneOffset.ofHours(8);
    public static final String STORE_ID = "STORE-001";

    private TestDataFactory() {}

    public static DetectionConfig defaultConfig() {
        return new DetectionConfig();
    }

    /**
     * Instant for a store-local date and time in UTC+8.
     */
    public static Instant localTime(LocalDate date, int hour, int minute) {
        return date.atTime(hour, minute).toInstant(STORE_ZONE);
    }

    public static ShiftRecord createShift(String shiftId, String storeId, Instant openedAt, double totalSales) {
        return ShiftRecord.builder()
                .shiftId(shiftId)
                .storeId(storeId)
                .openedAt(openedAt)
                .closedAt(openedAt != null ? openedAt.plusSeconds(7 * 3600) : null)
                .totalSales(totalSales)
                .build();
    }

    public static ShiftRecord createShiftWithProducts(String shiftId, String storeId, Instant openedAt,
                                                      double totalSales, long productA, long productB) {
        ShiftRecord shift = createShift(shiftId, storeId, openedAt, totalSales);
        shift.setProductACount(productA);
        shift.setProductBCount(productB);
        return shift;
    }

    public static Baseline createBaseline(double mean, double stdDev, long sampleCount) {
        return Baseline.builder()
                .mean(mean)
                .stdDev(stdDev)
                .sampleCount(sampleCount)
                .build();
    }

    public static CohortKey monAm() {
        return new CohortKey("Mon", TimeSlot.AM);
    }

    public static AnalysisReport createReport(Instant generatedAt) {
        return AnalysisReport.builder()
                .generatedAt(generatedAt)
                .baselineStart(generatedAt.minusSeconds(90L * 86400))
                .analysisStart(generatedAt.minusSeconds(7L * 86400))
                .build();
    }
}
