package com.pos.anomaly.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One point-of-sale shift with its summed payment total")
public class ShiftRecord {

    @Schema(description = "Unique shift identifier", example = "SHIFT-S4-000123")
    private String shiftId;

    @Schema(description = "Owning store identifier", example = "82034dd5-a404-43b4-9b2d-674e3bab0242")
    private String storeId;

    @Schema(description = "Shift opening time (ISO-8601). Rows without it, or with an unparseable value, " +
            "are rejected from analysis.", example = "2025-06-02T00:15:00Z")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant openedAt;

    @Schema(description = "Shift closing time (ISO-8601). Absent while the shift is still open.",
            example = "2025-06-02T08:05:00Z")
    private Instant closedAt;

    @Schema(description = "Sum of payment amounts for the shift, never negative", example = "18250.50")
    private double totalSales;

    @Schema(description = "Quantity of the first product of the compared pair sold in the shift", example = "4")
    private Long productACount;

    @Schema(description = "Quantity of the second product of the compared pair sold in the shift", example = "12")
    private Long productBCount;

    public boolean hasProductCounts() {
        return productACount != null && productBCount != null;
    }
}
