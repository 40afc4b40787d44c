package com.pos.anomaly.engine;

import com.pos.anomaly.model.CohortKey;
import lombok.Value;

/**
 * One historical metric value of a store cohort.
 */
@Value
public class BaselineSample {
    String storeId;
    CohortKey cohort;
    double value;
}
