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
@Schema(description = "Product-pair verdict for one shift")
public class RatioVerdict {

    @Schema(description = "Product A count divided by product B count (sentinel when B is 0 and A is not)",
            example = "9.99")
    private double ratio;

    @Schema(description = "Ratio exceeded the configured threshold", example = "true")
    private boolean highRatio;

    @Schema(description = "Product B count fell below its cohort's statistical threshold", example = "false")
    private boolean lowCountDip;

    @Schema(description = "Either condition fired", example = "true")
    private boolean anomalous;

    @Schema(description = "Conditions that fired, joined by '; '. Empty when normal.",
            example = "high product ratio")
    private String reason;
}
