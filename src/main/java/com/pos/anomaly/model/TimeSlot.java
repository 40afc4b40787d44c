package com.pos.anomaly.model;

import java.util.Optional;

/**
 * Coarse time-of-day band of a shift's local opening hour.
 * Hours outside both bands (overnight and mid-day handovers) have no slot.
 */
public enum TimeSlot {
    AM(4, 11),
    PM(16, 23);

    private final int firstHour;
    private final int lastHour;

    TimeSlot(int firstHour, int lastHour) {
        this.firstHour = firstHour;
        this.lastHour = lastHour;
    }

    public boolean contains(int hour) {
        return hour >= firstHour && hour <= lastHour;
    }

    public static Optional<TimeSlot> forHour(int hour) {
        for (TimeSlot slot : values()) {
            if (slot.contains(hour)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }
}
