package com.pos.anomaly.engine;

import lombok.Value;

import java.time.Instant;

/**
 * One shift's position and anomaly flag in a store's time-ordered sequence.
 */
@Value
public class RunCandidate {
    String shiftId;
    Instant openedAt;
    boolean anomalous;
}
