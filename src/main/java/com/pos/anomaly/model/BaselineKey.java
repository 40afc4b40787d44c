package com.pos.anomaly.model;

import lombok.Value;

@Value
public class BaselineKey {
    String storeId;
    CohortKey cohort;
}
