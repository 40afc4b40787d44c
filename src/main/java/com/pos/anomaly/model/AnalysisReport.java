package com.pos.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of one analysis run over a rolling window of shifts")
public class AnalysisReport {

    @Schema(description = "Reference time the windows were computed from", example = "2025-06-09T00:05:00Z")
    private Instant generatedAt;

    @Schema(description = "Oldest opening time considered", example = "2025-03-11T00:05:00Z")
    private Instant baselineStart;

    @Schema(description = "Split point: shifts opened at or after this are classified", example = "2025-06-02T00:05:00Z")
    private Instant analysisStart;

    @Schema(description = "Recent shifts with their verdicts, ordered by store, opening time and shift id")
    @Builder.Default
    private List<ShiftAnalysis> shifts = new ArrayList<>();

    @Schema(description = "Product-pair analyses for recent shifts that carry product counts")
    @Builder.Default
    private List<ShiftRatioAnalysis> ratioAnalyses = new ArrayList<>();

    @Schema(description = "Per-store overall performance, ordered by store id")
    @Builder.Default
    private List<StorePerformanceSummary> storeSummaries = new ArrayList<>();

    @Schema(description = "Rows rejected for a missing opening time", example = "0")
    private int rejectedRows;

    @Schema(description = "Rows left out because they opened outside the AM and PM bands", example = "3")
    private int excludedRows;
}
