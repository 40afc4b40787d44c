package com.pos.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger storesInAlert;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.storesInAlert = registry.gauge("analysis.stores.in_alert", new AtomicInteger(0));
    }

    public void recordShiftOutcome(String outcome) {
        Counter.builder("analysis.shifts.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRuleTriggered(String ruleType) {
        Counter.builder("analysis.rule.triggered.count")
                .tag("rule_type", ruleType)
                .register(registry)
                .increment();
    }

    public void recordRejectedRows(int count) {
        Counter.builder("analysis.rows.rejected.count")
                .register(registry)
                .increment(count);
    }

    public void recordAlertRun(String storeId) {
        Counter.builder("analysis.alert_run.count")
                .tag("store_id", storeId)
                .register(registry)
                .increment();
    }

    public void updateStoresInAlert(int count) {
        storesInAlert.set(count);
    }
}
