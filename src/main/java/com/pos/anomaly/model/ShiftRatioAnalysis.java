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
@Schema(description = "Product-pair analysis of one recent shift")
public class ShiftRatioAnalysis {

    @Schema(description = "Shift identifier", example = "SHIFT-S4-000123")
    private String shiftId;

    @Schema(description = "Store identifier", example = "82034dd5-a404-43b4-9b2d-674e3bab0242")
    private String storeId;

    @Schema(description = "Cohort of the shift")
    private CohortKey cohort;

    @Schema(description = "Product A quantity", example = "5")
    private long productACount;

    @Schema(description = "Product B quantity", example = "0")
    private long productBCount;

    @Schema(description = "Historical baseline of the product B count for this cohort")
    private Baseline productBBaseline;

    @Schema(description = "Ratio verdict")
    private RatioVerdict verdict;
}
