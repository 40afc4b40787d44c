package com.pos.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/**
 * Day-of-week x time-slot bucket used to compare like-with-like shifts.
 */
@Value
@Schema(description = "Day-of-week and time-slot cohort of a shift")
public class CohortKey {

    @Schema(description = "Local weekday abbreviation", example = "Mon")
    String dayName;

    @Schema(description = "Local time-of-day band", example = "AM")
    TimeSlot timeSlot;

    @Schema(description = "Display label", example = "Mon-AM")
    public String getLabel() {
        return dayName + "-" + timeSlot;
    }
}
