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
@Schema(description = "Membership of a shift in a run of consecutive anomalous shifts")
public class RunFlag {

    @Schema(description = "Shift belongs to an anomalous run at or above the minimum run length", example = "true")
    private boolean inAlertRun;

    @Schema(description = "Length of the anomalous run containing this shift, 0 for normal shifts", example = "3")
    private int runLength;
}
