package com.pos.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Overall recent-period performance of one store against its weekly historical average")
public class StorePerformanceSummary {

    @Schema(description = "Store identifier", example = "82034dd5-a404-43b4-9b2d-674e3bab0242")
    private String storeId;

    @Schema(description = "Configured display name, or the id when none is configured", example = "S4")
    private String storeName;

    @Schema(description = "Total sales of the analysed recent shifts", example = "152000.0")
    private double recentTotalSales;

    @Schema(description = "Average weekly sales over the historical part of the window", example = "160000.0")
    private double avgWeeklyBaselineSales;

    @Schema(description = "Recent total minus the weekly average", example = "-8000.0")
    private double salesDifference;

    @Schema(description = "Difference as a percentage of the weekly average", example = "-5.0")
    private double pctChange;

    @Schema(description = "False when there is not enough history to compute the weekly average", example = "true")
    private boolean hasBaseline;

    @Schema(description = "Number of analysed recent shifts", example = "14")
    private int recentShiftCount;

    @Schema(description = "Number of recent shifts flagged anomalous", example = "4")
    private int anomalousShiftCount;

    @Schema(description = "Number of recent shifts inside an alert run", example = "3")
    private int alertRunShiftCount;

    @Schema(description = "True when at least one alert run was found", example = "true")
    private boolean alert;
}
