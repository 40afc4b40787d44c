package com.pos.anomaly.controller;

import com.pos.anomaly.model.ShiftRecord;
import com.pos.anomaly.service.ShiftService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/shifts")
@Tag(name = "Shifts", description = "Store shift rows for the scheduled analysis and look them up")
public class ShiftController {

    private final ShiftService shiftService;

    public ShiftController(ShiftService shiftService) {
        this.shiftService = shiftService;
    }

    @Operation(summary = "Upsert shift rows",
            description = "Stores the rows keyed by shift id. Re-sending a shift replaces it. " +
                    "All rows are validated before any is written.")
    @PostMapping
    public ResponseEntity<?> saveShifts(@RequestBody List<ShiftRecord> shifts) {
        if (shifts == null || shifts.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "shifts must not be empty"));
        }
        try {
            int saved = shiftService.saveAll(shifts);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("savedCount", saved);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get a shift by ID")
    @GetMapping("/{shiftId}")
    public ResponseEntity<ShiftRecord> getShift(
            @Parameter(description = "Shift ID", example = "SHIFT-S4-000123")
            @PathVariable String shiftId) {
        ShiftRecord shift = shiftService.getShift(shiftId);
        if (shift == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(shift);
    }

    @Operation(summary = "List shifts by store", description = "Stored shifts of a store, newest first.")
    @GetMapping("/store/{storeId}")
    public ResponseEntity<List<ShiftRecord>> getShiftsByStore(
            @Parameter(description = "Store ID", example = "82034dd5-a404-43b4-9b2d-674e3bab0242")
            @PathVariable String storeId,
            @Parameter(description = "Max number of shifts to return", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(shiftService.getShiftsByStore(storeId, limit));
    }
}
