package com.pos.anomaly.controller;

import com.pos.anomaly.config.DetectionConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify the detection tunables")
public class ConfigController {

    private final DetectionConfig detectionConfig;

    public ConfigController(DetectionConfig detectionConfig) {
        this.detectionConfig = detectionConfig;
    }

    @Operation(summary = "Get detection tunables")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetection() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("baselineDays", detectionConfig.getBaselineDays());
        body.put("analysisDays", detectionConfig.getAnalysisDays());
        body.put("sensitivityK", detectionConfig.getSensitivityK());
        body.put("hardFloorRatio", detectionConfig.getHardFloorRatio());
        body.put("minRunLength", detectionConfig.getMinRunLength());
        body.put("ratioThreshold", detectionConfig.getRatio().getThreshold());
        body.put("ratioSentinel", detectionConfig.getRatio().getSentinel());
        body.put("zoneOffset", detectionConfig.getZoneOffset());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update detection tunables",
            description = "Changes apply to the next run but reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetection(@RequestBody Map<String, Object> body) {
        int baselineDays = toInt(body, "baselineDays", detectionConfig.getBaselineDays());
        int analysisDays = toInt(body, "analysisDays", detectionConfig.getAnalysisDays());
        double k = toDouble(body, "sensitivityK", detectionConfig.getSensitivityK());
        double floor = toDouble(body, "hardFloorRatio", detectionConfig.getHardFloorRatio());
        int minRun = toInt(body, "minRunLength", detectionConfig.getMinRunLength());
        double ratioThreshold = toDouble(body, "ratioThreshold", detectionConfig.getRatio().getThreshold());
        double sentinel = toDouble(body, "ratioSentinel", detectionConfig.getRatio().getSentinel());

        if (analysisDays <= 0) return badRequest("analysisDays must be > 0", "analysisDays");
        if (baselineDays <= analysisDays) return badRequest("baselineDays must be greater than analysisDays", "baselineDays");
        if (k <= 0) return badRequest("sensitivityK must be > 0", "sensitivityK");
        if (floor <= 0 || floor > 1) return badRequest("hardFloorRatio must be in (0, 1]", "hardFloorRatio");
        if (minRun < 1) return badRequest("minRunLength must be >= 1", "minRunLength");
        if (ratioThreshold <= 0) return badRequest("ratioThreshold must be > 0", "ratioThreshold");
        if (sentinel <= ratioThreshold) return badRequest("ratioSentinel must be greater than ratioThreshold", "ratioSentinel");

        detectionConfig.setBaselineDays(baselineDays);
        detectionConfig.setAnalysisDays(analysisDays);
        detectionConfig.setSensitivityK(k);
        detectionConfig.setHardFloorRatio(floor);
        detectionConfig.setMinRunLength(minRun);
        detectionConfig.getRatio().setThreshold(ratioThreshold);
        detectionConfig.getRatio().setSentinel(sentinel);

        return getDetection();
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
