package com.pos.anomaly.controller;

import com.pos.anomaly.model.AnalysisReport;
import com.pos.anomaly.model.AnalysisRequest;
import com.pos.anomaly.service.ScheduledAnalysisService;
import com.pos.anomaly.service.ShiftAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Classify recent shifts against their cohort baselines")
public class AnalysisController {

    private final ShiftAnalysisService analysisService;
    private final ScheduledAnalysisService scheduledAnalysisService;

    public AnalysisController(ShiftAnalysisService analysisService,
                              ScheduledAnalysisService scheduledAnalysisService) {
        this.analysisService = analysisService;
        this.scheduledAnalysisService = scheduledAnalysisService;
    }

    @Operation(summary = "Analyse supplied shift rows",
            description = "Runs the full analysis over the rows in the request body without reading or " +
                    "writing the shift store. Rows before now - analysisDays build baselines; later rows are " +
                    "classified and checked for consecutive low-sales runs.")
    @PostMapping
    public ResponseEntity<?> analyze(@RequestBody AnalysisRequest request) {
        if (request.getShifts() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "shifts is required"));
        }
        Instant now = request.getNow() != null ? request.getNow() : Instant.now();

        try {
            return ResponseEntity.ok(analysisService.analyze(request.getShifts(), now));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get the latest scheduled report",
            description = "Returns the report of the most recent scheduled or manually triggered run.")
    @GetMapping("/latest")
    public ResponseEntity<AnalysisReport> getLatest() {
        return scheduledAnalysisService.getLatestReport()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Run the scheduled analysis now",
            description = "Reads the rolling window from the shift store, analyses it and replaces the latest report.")
    @PostMapping("/run")
    public ResponseEntity<AnalysisReport> runNow() {
        return ResponseEntity.ok(scheduledAnalysisService.runAnalysis());
    }
}
