package com.pos.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Shift rows to analyse without touching the shift store")
public class AnalysisRequest {

    @Schema(description = "Reference time for the windows. Defaults to the current time if not provided.",
            example = "2025-06-09T00:05:00Z")
    private Instant now;

    @Schema(description = "Historical and recent shift rows")
    private List<ShiftRecord> shifts;
}
