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
@Schema(description = "Full analysis of one recent shift")
public class ShiftAnalysis {

    @Schema(description = "The analysed shift")
    private ShiftRecord shift;

    @Schema(description = "Cohort the shift was compared within")
    private CohortKey cohort;

    @Schema(description = "Historical baseline of the cohort for this store")
    private Baseline baseline;

    @Schema(description = "Low-sales verdict")
    private AnomalyVerdict verdict;

    @Schema(description = "Consecutive-anomaly run membership")
    private RunFlag runFlag;

    @Schema(description = "Sales difference against the cohort average")
    private ShiftPerformance performance;
}
