package com.pos.anomaly.engine;

import com.pos.anomaly.model.CohortKey;
import com.pos.anomaly.model.ShiftRecord;
import lombok.Value;

/**
 * A shift that passed cohort tagging.
 */
@Value
public class CohortShift {
    ShiftRecord shift;
    CohortKey cohort;
}
