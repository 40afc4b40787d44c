package com.pos.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Fixed offset of the stores' local time. Cohorts are derived in this zone.
    private String zoneOffset = "+08:00";

    // Trailing window read on every run; the most recent analysisDays of it are classified.
    private int baselineDays = 90;
    private int analysisDays = 7;

    // Statistical rule: flag when value < mean - sensitivityK * stdDev (and stdDev > 0).
    // Lower values raise alert frequency.
    private double sensitivityK = 1.8;

    // Hard rule: flag when value < mean * hardFloorRatio, regardless of variance.
    private double hardFloorRatio = 0.6;

    // Minimum number of consecutive anomalous shifts that raises a run alert.
    private int minRunLength = 3;

    // Store id -> display name for the stores being monitored.
    private Map<String, String> stores = new LinkedHashMap<>();

    private Ratio ratio = new Ratio();

    private Schedule schedule = new Schedule();

    public ZoneOffset storeZone() {
        return ZoneOffset.of(zoneOffset);
    }

    public String storeName(String storeId) {
        return stores.getOrDefault(storeId, storeId);
    }

    @Data
    public static class Ratio {
        // Product A / product B above this is flagged.
        private double threshold = 0.6;
        // Ratio reported when product B sold nothing but product A did.
        private double sentinel = 9.99;
    }

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private String cron = "0 5 8 * * *";
        private String zone = "Asia/Manila";
    }
}
