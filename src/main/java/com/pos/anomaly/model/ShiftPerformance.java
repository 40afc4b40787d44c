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
@Schema(description = "Shift sales compared with the historical average of its cohort")
public class ShiftPerformance {

    @Schema(description = "Historical cohort mean (0 when the cohort has no history)", example = "100.0")
    private double baselineMean;

    @Schema(description = "Shift sales minus the cohort mean", example = "-30.0")
    private double salesDifference;

    @Schema(description = "Difference as a percentage of the cohort mean, 0 without history", example = "-30.0")
    private double performancePct;
}
