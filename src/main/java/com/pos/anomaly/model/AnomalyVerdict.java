package com.pos.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Normal/anomalous decision for one shift")
public class AnomalyVerdict {

    @Schema(description = "Value fell more than k standard deviations below the cohort mean", example = "true")
    private boolean statisticalAnomaly;

    @Schema(description = "Value fell below the fixed fraction of the cohort mean", example = "false")
    private boolean hardRuleAnomaly;

    @Schema(description = "Either rule fired", example = "true")
    private boolean anomalous;

    @Schema(description = "Tags of the rules that fired", example = "[\"low sales (statistical)\"]")
    @Builder.Default
    private Set<String> reasons = new LinkedHashSet<>();

    @Schema(description = "Per-rule breakdown")
    private List<RuleResult> ruleResults;
}
