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
@Schema(description = "Historical mean and spread of a metric for one store cohort")
public class Baseline {

    @Schema(description = "Arithmetic mean of the historical values", example = "100.0")
    private double mean;

    @Schema(description = "Sample standard deviation (n-1). 0 with fewer than 2 samples.", example = "8.45")
    private double stdDev;

    @Schema(description = "Number of historical samples", example = "12")
    private long sampleCount;

    /**
     * Baseline for a cohort with no history. Neither low-sales rule can fire against it.
     */
    public static Baseline empty() {
        return new Baseline(0.0, 0.0, 0);
    }

    public boolean hasHistory() {
        return sampleCount > 0;
    }
}
