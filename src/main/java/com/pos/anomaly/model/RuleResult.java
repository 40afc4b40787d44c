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
@Schema(description = "Outcome of one low-sales rule against one shift")
public class RuleResult {

    @Schema(description = "Rule that produced this result", example = "STATISTICAL_DEVIATION")
    private AnomalyRuleType ruleType;

    @Schema(description = "Whether the rule flagged the value", example = "true")
    private boolean triggered;

    @Schema(description = "Metric value that was judged", example = "70.0")
    private double observedValue;

    @Schema(description = "Value below which the rule fires", example = "84.79")
    private double threshold;

    @Schema(description = "Human-readable explanation",
            example = "Statistical deviation: value=70.00 < mean 100.00 - 1.8 x std 8.46 = 84.78")
    private String reason;
}
