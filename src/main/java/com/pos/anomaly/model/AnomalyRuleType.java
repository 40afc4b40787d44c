package com.pos.anomaly.model;

public enum AnomalyRuleType {
    STATISTICAL_DEVIATION("low sales (statistical)"),
    HARD_FLOOR("low sales (hard rule)");

    private final String reasonTag;

    AnomalyRuleType(String reasonTag) {
        this.reasonTag = reasonTag;
    }

    public String getReasonTag() {
        return reasonTag;
    }
}
