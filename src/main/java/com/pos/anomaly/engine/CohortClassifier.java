package com.pos.anomaly.engine;

import com.pos.anomaly.config.DetectionConfig;
import com.pos.anomaly.model.CohortKey;
import com.pos.anomaly.model.TimeSlot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a shift's opening time to its day-of-week x time-slot cohort in store-local time.
 *
 * Shifts opening outside the AM (04-11h) and PM (16-23h) bands get no cohort
 * and take no part in baseline or anomaly computation.
 */
@Component
public class CohortClassifier {

    private final DetectionConfig config;

    public CohortClassifier(DetectionConfig config) {
        this.config = config;
    }

    public Optional<CohortKey> classify(Instant openedAt) {
        if (openedAt == null) {
            return Optional.empty();
        }
        OffsetDateTime local = openedAt.atOffset(config.storeZone());
        String dayName = local.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
        return TimeSlot.forHour(local.getHour())
                .map(slot -> new CohortKey(dayName, slot));
    }
}
